package io.plandigest.core.analysis;

import io.plandigest.core.report.DurationStats;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order statistics over durations expressed in seconds.
 */
public final class DurationStatistics {

    private DurationStatistics() {
    }

    /**
     * Linear-interpolated percentile: {@code index = p/100 * (n-1)}, interpolating between the two
     * neighbouring ranks when the index is fractional. Returns {@code 0.0} for an empty input.
     */
    public static double percentile(List<Double> values, double percentile) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = sortedCopy(values);
        double safe = Math.max(0.0, Math.min(100.0, percentile));
        double index = (safe / 100.0) * (sorted.size() - 1);
        int lower = (int) Math.floor(index);
        if (index == lower) {
            return sorted.get(lower);
        }
        double weight = index - lower;
        return sorted.get(lower) * (1 - weight) + sorted.get(lower + 1) * weight;
    }

    public static double median(List<Double> values) {
        return percentile(values, 50);
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        return sum(values) / values.size();
    }

    public static double sum(List<Double> values) {
        if (values == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Double value : values) {
            total += value;
        }
        return total;
    }

    public static double min(List<Double> values) {
        return values == null || values.isEmpty() ? 0.0 : Collections.min(values);
    }

    public static double max(List<Double> values) {
        return values == null || values.isEmpty() ? 0.0 : Collections.max(values);
    }

    public static DurationStats summarize(List<Double> seconds) {
        if (seconds == null || seconds.isEmpty()) {
            return DurationStats.empty();
        }
        return new DurationStats(
            seconds.size(),
            mean(seconds),
            median(seconds),
            percentile(seconds, 95),
            min(seconds),
            max(seconds)
        );
    }

    static double percentage(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private static List<Double> sortedCopy(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted;
    }
}
