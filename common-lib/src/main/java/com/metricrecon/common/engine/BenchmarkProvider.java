package com.metricrecon.common.engine;

import com.metricrecon.common.model.BenchmarkRange;

import java.util.Optional;

/**
 * Supplies the industry range an entity's metric is compared against, if one is known.
 */
@FunctionalInterface
public interface BenchmarkProvider {

    Optional<BenchmarkRange> benchmarkFor(String entityId, String metricName);

    static BenchmarkProvider none() {
        return (entityId, metricName) -> Optional.empty();
    }
}
