package com.sysmuse.fuzzy.binding;

import java.util.Arrays;

/**
 * Summary of a set of samples. Standard deviation is the sample (n - 1) estimate;
 * percentiles interpolate linearly between ranks.
 */
public class Statistics {

    private final double[] sorted;
    private final double mean;
    private final double stddev;

    public Statistics(double[] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("Statistics need at least one sample");
        }
        this.sorted = samples.clone();
        Arrays.sort(sorted);

        double sum = 0;
        for (double s : sorted) {
            sum += s;
        }
        this.mean = sum / sorted.length;

        double squares = 0;
        for (double s : sorted) {
            squares += (s - mean) * (s - mean);
        }
        this.stddev = sorted.length > 1 ? Math.sqrt(squares / (sorted.length - 1)) : 0;
    }

    public int getCount() {
        return sorted.length;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stddev;
    }

    public double getMin() {
        return sorted[0];
    }

    public double getMax() {
        return sorted[sorted.length - 1];
    }

    /**
     * @param p percentile between 0 and 100
     */
    public double percentile(double p) {
        if (p < 0 || p > 100 || Double.isNaN(p)) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100, got " + p);
        }
        double rank = p / 100 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    public double getMedian() {
        return percentile(50);
    }

    @Override
    public String toString() {
        return String.format("n=%d mean=%.6g stddev=%.6g min=%.6g max=%.6g",
                getCount(), mean, stddev, getMin(), getMax());
    }
}
