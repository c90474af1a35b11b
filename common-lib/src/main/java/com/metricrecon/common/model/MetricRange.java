package com.metricrecon.common.model;

/**
 * Inclusive plausibility bounds for one metric. Validated when the range table is built.
 */
public record MetricRange(String metricName, double min, double max) {

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
