package com.metricrecon.common;

import com.metricrecon.common.anomaly.AnomalyDetector;
import com.metricrecon.common.anomaly.MetricRangeTable;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.Observation;
import com.metricrecon.common.model.SourceCategory;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.resolution.ConflictResolver;
import com.metricrecon.common.scoring.ConfidenceScorer;
import com.metricrecon.common.scoring.DataQualityScorer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared registry and observation builders for engine tests.
 */
public final class Fixtures {

    public static final Instant NOW   = Instant.parse("2024-05-01T00:00:00Z");
    public static final Clock   CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final String REVENUE = "revenue";
    public static final String ENTITY  = "AAPL";
    public static final String PERIOD  = "2024Q1";
    public static final MetricKey KEY  = new MetricKey(REVENUE, ENTITY, PERIOD);

    public static final String SEC        = "sec-edgar";
    public static final String AGG_A      = "aggregator-a";
    public static final String AGG_B      = "aggregator-b";
    public static final String RELIABLE   = "reliable-x";
    public static final String ANALYST    = "analyst-z";

    private Fixtures() {}

    /**
     * sec-edgar REGULATORY 1.0 · aggregator-a/b MULTI_SOURCE_AGGREGATE 0.8 · reliable-x SINGLE_RELIABLE 0.7 ·
     * analyst-z PREDICTIVE 0.5; every accuracy 1.0.
     */
    public static SourceRegistry registry() {
        return registry(1.0);
    }

    public static SourceRegistry registry(double accuracy) {
        return SourceRegistry.builder()
            .register(SEC,      SourceCategory.REGULATORY,             1.0, accuracy)
            .register(AGG_A,    SourceCategory.MULTI_SOURCE_AGGREGATE, 0.8, accuracy)
            .register(AGG_B,    SourceCategory.MULTI_SOURCE_AGGREGATE, 0.8, accuracy)
            .register(RELIABLE, SourceCategory.SINGLE_RELIABLE,        0.7, accuracy)
            .register(ANALYST,  SourceCategory.PREDICTIVE,             0.5, accuracy)
            .clock(CLOCK)
            .build();
    }

    public static ConflictResolver resolver(SourceRegistry registry, MetricRangeTable ranges) {
        return new ConflictResolver(registry, new ConfidenceScorer(registry),
            new AnomalyDetector(ranges), new DataQualityScorer());
    }

    public static ConflictResolver resolver(SourceRegistry registry) {
        return resolver(registry, MetricRangeTable.empty());
    }

    public static Observation obs(String sourceId, double value) {
        return new Observation(REVENUE, ENTITY, PERIOD, value, sourceId, NOW);
    }

    public static Observation obs(String sourceId, double value, Instant observedAt) {
        return new Observation(REVENUE, ENTITY, PERIOD, value, sourceId, observedAt);
    }
}
