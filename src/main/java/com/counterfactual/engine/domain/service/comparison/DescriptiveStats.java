package com.counterfactual.engine.domain.service.comparison;

import java.util.Arrays;

final class DescriptiveStats {

    private final double[] sorted;
    private final double mean;

    DescriptiveStats(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("statistics need at least one value");
        }
        this.sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double v : sorted) sum += v;
        this.mean = sum / sorted.length;
    }

    int count() {
        return sorted.length;
    }

    double mean() {
        return mean;
    }

    double min() {
        return sorted[0];
    }

    double max() {
        return sorted[sorted.length - 1];
    }

    double median() {
        return percentile(50);
    }

    /**
     * Sample standard deviation; NaN for a single value.
     */
    double std() {
        if (sorted.length < 2) return Double.NaN;
        double sumSq = 0.0;
        for (double v : sorted) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (sorted.length - 1));
    }

    double percentile(double p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    int positives() {
        int n = 0;
        for (double v : sorted) if (v > 0) n++;
        return n;
    }

    int negatives() {
        int n = 0;
        for (double v : sorted) if (v < 0) n++;
        return n;
    }

    int zeros() {
        return sorted.length - positives() - negatives();
    }
}
