package com.vespasync.sync.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-width integer histogram over an inclusive integer domain, one bin per value.
 */
public final class Histogram {
    public static final Histogram SCORES = new Histogram(0, 10);
    public static final Histogram READINESS = new Histogram(1, 5);

    private final int min;
    private final int max;

    public Histogram(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max < min");
        }
        this.min = min;
        this.max = max;
    }

    public int bins() {
        return max - min + 1;
    }

    /**
     * Bin index of a value rounded half-up and clamped to the domain.
     */
    public int binOf(double value) {
        int rounded = BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).intValue();
        int clamped = Math.max(min, Math.min(max, rounded));
        return clamped - min;
    }

    public int[] count(double[] values) {
        int[] bins = new int[bins()];
        if (values == null) {
            return bins;
        }
        for (double v : values) {
            bins[binOf(v)]++;
        }
        return bins;
    }

    public static int[] sum(int[] left, int[] right) {
        if (left == null) {
            return right == null ? new int[0] : right.clone();
        }
        if (right == null) {
            return left.clone();
        }
        int[] out = new int[Math.max(left.length, right.length)];
        for (int i = 0; i < out.length; i++) {
            out[i] = (i < left.length ? left[i] : 0) + (i < right.length ? right[i] : 0);
        }
        return out;
    }
}
