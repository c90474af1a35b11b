package com.metricrecon.reconciliation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricrecon.common.anomaly.AnomalyDetector;
import com.metricrecon.common.anomaly.MetricRangeTable;
import com.metricrecon.common.engine.BenchmarkProvider;
import com.metricrecon.common.engine.MetricHistoryProvider;
import com.metricrecon.common.engine.ReconciliationEngine;
import com.metricrecon.common.exception.ReconciliationConfigException;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.resolution.ConflictResolver;
import com.metricrecon.common.review.ReviewQueueManager;
import com.metricrecon.common.scoring.ConfidenceScorer;
import com.metricrecon.common.scoring.DataQualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the engine from {@link ReconciliationProperties}. The engine classes carry no Spring
 * annotations; everything is wired here.
 */
@Configuration
public class ReconciliationConfig {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceRegistry sourceRegistry(ReconciliationProperties properties, Clock clock) {
        if (properties.getSources().isEmpty()) {
            throw new ReconciliationConfigException("reconciliation.sources", "at least one source must be configured");
        }
        SourceRegistry.Builder builder = SourceRegistry.builder().clock(clock);
        properties.getCategoryWeights().forEach(builder::categoryWeight);
        for (ReconciliationProperties.SourceProperties s : properties.getSources()) {
            builder.register(s.getId(), s.getCategory(), s.getBaseWeight(), s.getHistoricalAccuracy());
        }
        return builder.build();
    }

    @Bean
    public MetricRangeTable metricRangeTable(ReconciliationProperties properties) {
        MetricRangeTable.Builder builder = MetricRangeTable.builder();
        properties.getMetricRanges().forEach((metric, bounds) -> builder.range(metric, bounds.getMin(), bounds.getMax()));
        MetricRangeTable table = builder.build();
        log.info("Metric ranges loaded. metrics={}", table.size());
        return table;
    }

    @Bean
    public AnomalyDetector anomalyDetector(MetricRangeTable metricRangeTable, ReconciliationProperties properties) {
        return new AnomalyDetector(metricRangeTable, properties.getPeerTolerance());
    }

    @Bean
    public ConfidenceScorer confidenceScorer(SourceRegistry sourceRegistry) {
        return new ConfidenceScorer(sourceRegistry);
    }

    @Bean
    public DataQualityScorer dataQualityScorer(ReconciliationProperties properties) {
        return new DataQualityScorer(properties.getFreshnessHalfLife(), properties.getExpectedSourceCount());
    }

    @Bean
    public ConflictResolver conflictResolver(SourceRegistry sourceRegistry,
                                             ConfidenceScorer confidenceScorer,
                                             AnomalyDetector anomalyDetector,
                                             DataQualityScorer dataQualityScorer) {
        return new ConflictResolver(sourceRegistry, confidenceScorer, anomalyDetector, dataQualityScorer);
    }

    @Bean
    public ReviewQueueManager reviewQueueManager(SourceRegistry sourceRegistry,
                                                 ReconciliationProperties properties,
                                                 Clock clock) {
        return new ReviewQueueManager(sourceRegistry, properties.getReviewThreshold(),
                                      properties.getAccuracyStep(), clock);
    }

    /**
     * History is loaded reactively by the service and handed over in an explicit context,
     * so the engine's own history provider stays empty.
     */
    @Bean
    public ReconciliationEngine reconciliationEngine(ConflictResolver conflictResolver,
                                                     ReviewQueueManager reviewQueueManager,
                                                     SourceRegistry sourceRegistry,
                                                     BenchmarkProvider benchmarkProvider,
                                                     Clock clock) {
        return new ReconciliationEngine(conflictResolver, reviewQueueManager, sourceRegistry,
                                        MetricHistoryProvider.none(), benchmarkProvider, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
