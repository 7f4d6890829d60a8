package com.raredisease.prioritization.normalize;

import java.util.Collection;

/**
 * First, second and third quartile of a sample, using linear interpolation
 * between closest ranks.
 */
public record Quartiles(double q1, double median, double q3) {

    public static final Quartiles EMPTY = new Quartiles(0.0, 0.0, 0.0);

    public static Quartiles of(Collection<? extends Number> sample) {
        if (sample.isEmpty()) {
            return EMPTY;
        }
        double[] sorted = sample.stream().mapToDouble(Number::doubleValue).sorted().toArray();
        return new Quartiles(percentile(sorted, 0.25), percentile(sorted, 0.50), percentile(sorted, 0.75));
    }

    public double iqr() {
        return q3 - q1;
    }

    /**
     * Upper fence {@code Q3 + multiplier * IQR}.
     */
    public double upperFence(double multiplier) {
        return q3 + multiplier * iqr();
    }

    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
