package com.askdata.executor;

import java.util.Arrays;

/**
 * Finite numeric values pulled out of one column, with a count of the non-finite values that
 * were dropped on the way.
 */
final class NumericSample {
    private final double[] values;
    private final int dropped;

    NumericSample(double[] values, int dropped) {
        this.values = values;
        this.dropped = dropped;
    }

    int size() {
        return values.length;
    }

    boolean isEmpty() {
        return values.length == 0;
    }

    int dropped() {
        return dropped;
    }

    double[] values() {
        return values;
    }

    double sum() {
        double s = 0.0;
        for (double v : values) {
            s += v;
        }
        return s;
    }

    double mean() {
        return values.length == 0 ? Double.NaN : sum() / values.length;
    }

    /**
     * Sample standard deviation; 0 for a single value, NaN for none.
     */
    double std() {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (values.length == 1) {
            return 0.0;
        }
        double mean = mean();
        double ss = 0.0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (values.length - 1));
    }

    double min() {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).min().getAsDouble();
    }

    double max() {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).max().getAsDouble();
    }
}
