package com.metricrecon.reconciliation.service;

import com.metricrecon.common.engine.BenchmarkProvider;
import com.metricrecon.common.exception.ReconciliationConfigException;
import com.metricrecon.common.model.BenchmarkRange;
import com.metricrecon.reconciliation.config.ReconciliationProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Industry benchmarks from {@code reconciliation.benchmarks}, one range per metric name,
 * applied to every entity.
 */
@Component
public class ConfiguredBenchmarkProvider implements BenchmarkProvider {

    private final Map<String, BenchmarkRange> benchmarks = new TreeMap<>();

    public ConfiguredBenchmarkProvider(ReconciliationProperties properties) {
        properties.getBenchmarks().forEach((metric, bounds) -> {
            if (bounds.getMin() > bounds.getMax()) {
                throw new ReconciliationConfigException(metric,
                    "benchmark min " + bounds.getMin() + " exceeds max " + bounds.getMax());
            }
            benchmarks.put(metric, new BenchmarkRange(bounds.getMin(), bounds.getMax()));
        });
    }

    @Override
    public Optional<BenchmarkRange> benchmarkFor(String entityId, String metricName) {
        return Optional.ofNullable(benchmarks.get(metricName));
    }
}
