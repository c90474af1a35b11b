package com.metricrecon.reconciliation.config;

import com.metricrecon.common.engine.ReconciliationEngine;
import com.metricrecon.common.exception.InvalidMetricRangeException;
import com.metricrecon.common.exception.ReconciliationConfigException;
import com.metricrecon.common.model.SourceCategory;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.review.ReviewQueueManager;
import com.metricrecon.reconciliation.service.ConfiguredBenchmarkProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.NestedExceptionUtils;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
        .withUserConfiguration(ReconciliationProperties.class, ReconciliationConfig.class,
                               ConfiguredBenchmarkProvider.class)
        .withPropertyValues(
            "reconciliation.review-threshold=0.35",
            "reconciliation.category-weights.PREDICTIVE=0.5",
            "reconciliation.sources[0].id=sec-edgar",
            "reconciliation.sources[0].category=REGULATORY",
            "reconciliation.sources[0].base-weight=1.0",
            "reconciliation.sources[1].id=analyst-consensus",
            "reconciliation.sources[1].category=PREDICTIVE",
            "reconciliation.sources[1].base-weight=0.5",
            "reconciliation.sources[1].historical-accuracy=0.7",
            "reconciliation.metric-ranges.revenue.min=0",
            "reconciliation.metric-ranges.revenue.max=1e13");

    @Test
    @DisplayName("valid configuration builds the engine")
    void buildsEngine() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());
            assertNotNull(context.getBean(ReconciliationEngine.class));

            SourceRegistry registry = context.getBean(SourceRegistry.class);
            assertEquals(0.7, registry.getSource("analyst-consensus").historicalAccuracy(), 1e-12);
            assertEquals(1.0, registry.getSource("sec-edgar").historicalAccuracy(), 1e-12);
            assertEquals(0.5, registry.categoryWeight(SourceCategory.PREDICTIVE), 1e-12);
            assertEquals(0.35, context.getBean(ReviewQueueManager.class).reviewThreshold(), 1e-12);
        });
    }

    @Test
    @DisplayName("range with min > max fails at startup")
    void invalidRange() {
        runner.withPropertyValues("reconciliation.metric-ranges[gross_margin].min=1",
                                  "reconciliation.metric-ranges[gross_margin].max=-1")
            .run(context -> {
                assertNotNull(context.getStartupFailure());
                assertInstanceOf(InvalidMetricRangeException.class,
                    NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure()));
            });
    }

    @Test
    @DisplayName("base weight outside [0,1] fails at startup")
    void invalidBaseWeight() {
        runner.withPropertyValues("reconciliation.sources[1].base-weight=1.5")
            .run(context -> assertInstanceOf(ReconciliationConfigException.class,
                NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure())));
    }

    @Test
    @DisplayName("benchmark with min > max fails at startup")
    void invalidBenchmark() {
        runner.withPropertyValues("reconciliation.benchmarks[gross_margin].min=0.6",
                                  "reconciliation.benchmarks[gross_margin].max=0.2")
            .run(context -> assertInstanceOf(ReconciliationConfigException.class,
                NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure())));
    }
}
