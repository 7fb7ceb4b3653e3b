package com.bmsedge.seriesprep.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TableProfile {

    private final Map<String, ColumnProfile> profiles;

    public TableProfile(List<ColumnProfile> columnProfiles) {
        Map<String, ColumnProfile> index = new LinkedHashMap<>();
        for (ColumnProfile profile : columnProfiles) {
            index.put(profile.getColumnName(), profile);
        }
        this.profiles = Collections.unmodifiableMap(index);
    }

    public ColumnProfile get(String columnName) {
        ColumnProfile profile = profiles.get(columnName);
        if (profile == null) {
            throw new IllegalArgumentException("No profile for column: " + columnName);
        }
        return profile;
    }

    public List<ColumnProfile> getColumns() {
        return new ArrayList<>(profiles.values());
    }

    public List<String> columnsWithRole(ColumnRole role) {
        List<String> names = new ArrayList<>();
        for (ColumnProfile profile : profiles.values()) {
            if (profile.getRole() == role) {
                names.add(profile.getColumnName());
            }
        }
        return names;
    }
}
