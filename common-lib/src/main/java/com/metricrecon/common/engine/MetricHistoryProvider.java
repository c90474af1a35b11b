package com.metricrecon.common.engine;

import java.util.List;

/**
 * Supplies an entity's trailing final values for a metric from periods before {@code period},
 * oldest first. Backed by the persistent store in a deployment.
 */
@FunctionalInterface
public interface MetricHistoryProvider {

    List<Double> trailingValues(String entityId, String metricName, String period);

    static MetricHistoryProvider none() {
        return (entityId, metricName, period) -> List.of();
    }
}
