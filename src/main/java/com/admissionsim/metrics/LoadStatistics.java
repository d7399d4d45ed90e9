package com.admissionsim.metrics;

/**
 * Aggregate statistics over one resource's per-server loads.
 * Variance is the population variance (divide by N).
 */
public final class LoadStatistics {

    private static final LoadStatistics EMPTY = new LoadStatistics(0, 0, 0, 0, 0);

    private final double mean;
    private final double variance;
    private final double stdDev;
    private final double min;
    private final double max;

    private LoadStatistics(double mean, double variance, double stdDev, double min, double max) {
        this.mean = mean;
        this.variance = variance;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
    }

    /**
     * Computes statistics for the given values. An empty array yields all zeros.
     */
    public static LoadStatistics of(double[] values) {
        if (values.length == 0) {
            return EMPTY;
        }
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.length;
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double variance = squares / values.length;
        return new LoadStatistics(mean, variance, Math.sqrt(variance), min, max);
    }

    public double getMean() { return mean; }
    public double getVariance() { return variance; }
    public double getStdDev() { return stdDev; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    @Override
    public String toString() {
        return String.format("mean=%.1f, var=%.1f, std=%.1f, min=%.1f, max=%.1f",
                mean, variance, stdDev, min, max);
    }
}
