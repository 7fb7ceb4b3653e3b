package com.bmsedge.seriesprep.util;

import com.bmsedge.seriesprep.model.CellValue;
import com.bmsedge.seriesprep.model.RawColumn;
import com.bmsedge.seriesprep.model.RawTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins key-column values into a cd_key. Parts are trimmed, kept in mapping order, and a
 * missing part becomes the null token so that keys stay positional.
 */
public class KeyBuilder {

    private final List<RawColumn> keyColumns;
    private final String separator;
    private final String nullToken;

    public KeyBuilder(RawTable table, List<String> keyColumnNames, String separator, String nullToken) {
        this.keyColumns = new ArrayList<>(keyColumnNames.size());
        for (String name : keyColumnNames) {
            keyColumns.add(table.getColumn(name));
        }
        this.separator = separator;
        this.nullToken = nullToken != null ? nullToken : "";
    }

    public String keyFor(int rowIndex) {
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < keyColumns.size(); i++) {
            if (i > 0) {
                key.append(separator);
            }
            CellValue cell = keyColumns.get(i).get(rowIndex);
            key.append(cell.isMissing() ? nullToken : cell.asText());
        }
        return key.toString();
    }
}
