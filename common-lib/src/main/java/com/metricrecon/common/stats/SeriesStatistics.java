package com.metricrecon.common.stats;

import java.util.List;

/**
 * Population statistics over small numeric series. Stateless; empty input yields 0.0.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    public static double stddev(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.size());
    }

    /**
     * {@code Σ w·(v − center)² / Σ w}; 0.0 when the weights sum to zero.
     */
    public static double weightedVariance(List<Double> values, List<Double> weights, double center) {
        double totalWeight = 0.0;
        double acc = 0.0;
        for (int i = 0; i < values.size(); i++) {
            double w = weights.get(i);
            double d = values.get(i) - center;
            acc += w * d * d;
            totalWeight += w;
        }
        return totalWeight > 0.0 ? acc / totalWeight : 0.0;
    }
}
