package com.bmsedge.seriesprep.service;

import com.bmsedge.seriesprep.config.PipelineProperties;
import com.bmsedge.seriesprep.model.FrequencyLabel;
import com.bmsedge.seriesprep.model.TimeFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Infers the sampling cadence of a set of dates from the gaps between consecutive distinct dates.
 *
 * <p>Each gap is put in the bucket whose width it matches. Gaps spanning a whole number of the
 * dominant width (missing periods) count for the dominant bucket too. When no bucket reaches the
 * share threshold the series is {@link TimeFrequency#IRREGULAR} and flagged inconclusive.</p>
 */
@Component
public class FrequencyInferencer {

    private static final Logger logger = LoggerFactory.getLogger(FrequencyInferencer.class);

    private final PipelineProperties properties;

    public FrequencyInferencer(PipelineProperties properties) {
        this.properties = properties;
    }

    public FrequencyLabel infer(Collection<LocalDate> dates) {
        List<LocalDate> sorted = new ArrayList<>(new TreeSet<>(dates));
        int points = sorted.size();
        int minPoints = Math.max(2, properties.getMinFrequencyPoints());
        if (points < minPoints) {
            return new FrequencyLabel(TimeFrequency.IRREGULAR, 0.0, null, medianDeltaDays(sorted), points, true,
                    String.format("only %d distinct dates, need %d", points, minPoints));
        }

        int totalDeltas = points - 1;
        Map<TimeFrequency, Integer> direct = new EnumMap<>(TimeFrequency.class);
        List<LocalDate[]> unmatched = new ArrayList<>();
        // Month-aligned 28-day gaps (Feb 1 -> Mar 1) are also four weeks; settled once the dominant bucket is known
        List<LocalDate[]> fourWeekGaps = new ArrayList<>();
        for (int i = 1; i < points; i++) {
            LocalDate from = sorted.get(i - 1);
            LocalDate to = sorted.get(i);
            TimeFrequency bucket = bucketOf(from, to);
            if (bucket == null) {
                unmatched.add(new LocalDate[]{from, to});
            } else if (bucket == TimeFrequency.MONTHLY && ChronoUnit.DAYS.between(from, to) % 7 == 0) {
                fourWeekGaps.add(new LocalDate[]{from, to});
            } else {
                direct.merge(bucket, 1, Integer::sum);
            }
        }

        TimeFrequency dominant = dominantOf(direct);
        if (!fourWeekGaps.isEmpty()) {
            if (dominant == TimeFrequency.WEEKLY) {
                unmatched.addAll(fourWeekGaps);
            } else {
                direct.merge(TimeFrequency.MONTHLY, fourWeekGaps.size(), Integer::sum);
                dominant = dominantOf(direct);
            }
        }
        int dominantCount = dominant != null ? direct.get(dominant) : 0;

        int multiples = 0;
        if (dominant != null) {
            for (LocalDate[] gap : unmatched) {
                if (isMultipleOf(dominant, gap[0], gap[1])) {
                    multiples++;
                }
            }
        }

        double share = (double) (dominantCount + multiples) / totalDeltas;
        Double median = medianDeltaDays(sorted);
        FrequencyLabel label;
        if (dominant != null && share >= properties.getFrequencyShareThreshold()) {
            String notes = multiples > 0
                    ? String.format("%d of %d gaps span missing periods", multiples, totalDeltas)
                    : null;
            label = new FrequencyLabel(dominant, share, dominant.getInterval(), median, points, false, notes);
        } else {
            String notes = dominant == null
                    ? "no gap matches a known cadence"
                    : String.format("best cadence %s covers only %.0f%% of gaps", dominant, share * 100);
            label = new FrequencyLabel(TimeFrequency.IRREGULAR, 1.0 - share, null, median, points, true, notes);
        }
        logger.debug("Frequency inferred from {} dates: {}", points, label);
        return label;
    }

    // First bucket in declaration order wins a tie
    private static TimeFrequency dominantOf(Map<TimeFrequency, Integer> counts) {
        TimeFrequency dominant = null;
        int dominantCount = 0;
        for (Map.Entry<TimeFrequency, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }
        return dominant;
    }

    private static TimeFrequency bucketOf(LocalDate from, LocalDate to) {
        long days = ChronoUnit.DAYS.between(from, to);
        if (days == 1) {
            return TimeFrequency.DAILY;
        }
        if (days >= 6 && days <= 8) {
            return TimeFrequency.WEEKLY;
        }
        if (days >= 28 && days <= 31 && monthAligned(from, to, 1)) {
            return TimeFrequency.MONTHLY;
        }
        if (days >= 89 && days <= 92) {
            return TimeFrequency.QUARTERLY;
        }
        if (days == 365 || days == 366) {
            return TimeFrequency.YEARLY;
        }
        return null;
    }

    private boolean isMultipleOf(TimeFrequency dominant, LocalDate from, LocalDate to) {
        int limit = properties.getGapMultiplierLimit();
        long days = ChronoUnit.DAYS.between(from, to);
        switch (dominant) {
            case DAILY:
                return days >= 2 && days < limit;
            case WEEKLY:
                return days % 7 == 0 && days / 7 >= 2 && days / 7 < limit;
            case MONTHLY:
                return calendarMultiple(from, to, 1, limit);
            case QUARTERLY:
                return calendarMultiple(from, to, 3, limit);
            case YEARLY:
                return calendarMultiple(from, to, 12, limit);
            default:
                return false;
        }
    }

    private static boolean calendarMultiple(LocalDate from, LocalDate to, int stepMonths, int limit) {
        long months = ChronoUnit.MONTHS.between(YearMonth.from(from), YearMonth.from(to));
        if (months % stepMonths != 0) {
            return false;
        }
        long k = months / stepMonths;
        return k >= 2 && k < limit && monthAligned(from, to, (int) months);
    }

    /**
     * True when {@code to} falls the given number of calendar months after {@code from} on the same
     * day of month, allowing for month ends and for days clamped to a shorter month.
     */
    static boolean monthAligned(LocalDate from, LocalDate to, int months) {
        if (!YearMonth.from(from).plusMonths(months).equals(YearMonth.from(to))) {
            return false;
        }
        boolean fromEnd = from.getDayOfMonth() == from.lengthOfMonth();
        boolean toEnd = to.getDayOfMonth() == to.lengthOfMonth();
        if (from.getDayOfMonth() == to.getDayOfMonth() || (fromEnd && toEnd)) {
            return true;
        }
        // Jan 31 -> Feb 29 -> Mar 31 style sequences
        return (toEnd && to.getDayOfMonth() < from.getDayOfMonth())
                || (fromEnd && to.getDayOfMonth() > from.getDayOfMonth());
    }

    private static Double medianDeltaDays(List<LocalDate> sorted) {
        if (sorted.size() < 2) {
            return null;
        }
        List<Long> deltas = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            deltas.add(ChronoUnit.DAYS.between(sorted.get(i - 1), sorted.get(i)));
        }
        deltas.sort(null);
        int mid = deltas.size() / 2;
        if (deltas.size() % 2 == 1) {
            return deltas.get(mid).doubleValue();
        }
        return (deltas.get(mid - 1) + deltas.get(mid)) / 2.0;
    }
}
