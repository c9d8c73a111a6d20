package com.vespasync.sync.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * Order statistics and moments over small double samples.
 */
public final class DescriptiveStats {
    private DescriptiveStats() {
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n-1 denominator); 0 for fewer than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values == null || values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    /**
     * Continuous percentile with linear interpolation between closest ranks, as PostgreSQL
     * {@code percentile_cont}.
     *
     * @param fraction 0..1
     */
    public static double percentileCont(double[] values, double fraction) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double[] sorted = sortedCopy(values);
        double f = Math.max(0.0, Math.min(1.0, fraction));
        double pos = f * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (pos - lower);
    }

    public static double median(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double[] sorted = sortedCopy(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Quartile cut points by the exclusive method ((n+1) positions, interpolation index clamped
     * to the sample); at least two values are required.
     *
     * @return {q1, q2, q3}
     */
    public static double[] exclusiveQuartiles(double[] values) {
        if (values == null || values.length < 2) {
            throw new IllegalArgumentException("exclusive quartiles need at least two values");
        }
        double[] data = sortedCopy(values);
        int ld = data.length;
        int n = 4;
        int m = ld + 1;
        double[] out = new double[n - 1];
        for (int i = 1; i < n; i++) {
            int j = i * m / n;
            if (j < 1) {
                j = 1;
            } else if (j > ld - 1) {
                j = ld - 1;
            }
            int delta = i * m - j * n;
            out[i - 1] = (data[j - 1] * (n - delta) + data[j] * delta) / n;
        }
        return out;
    }

    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }
}
