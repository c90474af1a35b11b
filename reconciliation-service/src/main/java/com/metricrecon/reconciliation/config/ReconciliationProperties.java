package com.metricrecon.reconciliation.config;

import com.metricrecon.common.model.SourceCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment settings of the resolution engine, bound from {@code reconciliation.*}.
 *
 * <p>Values are range-checked when the engine beans are built, so a bad file stops the
 * service at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "reconciliation")
@Data
public class ReconciliationProperties {

    /** Resolutions below this confidence are queued for human review. */
    private double reviewThreshold = 0.4;

    /** Accuracy change applied to each contributing source per review decision. */
    private double accuracyStep = 0.02;

    private Duration freshnessHalfLife = Duration.ofDays(90);

    /** Number of earlier periods fed to the trend check. */
    private int trailingHistorySize = 8;

    /** Source count at which completeness reaches 1.0. */
    private int expectedSourceCount = 3;

    /** Fraction of the benchmark width tolerated on either side before a peer finding. */
    private double peerTolerance = 0.25;

    /** Units resolved in parallel by a batch request. */
    private int batchConcurrency = 4;

    /** Overrides of the default category weights; unlisted categories keep their default. */
    private Map<SourceCategory, Double> categoryWeights = new LinkedHashMap<>();

    private List<SourceProperties> sources = new ArrayList<>();

    private Map<String, Bounds> metricRanges = new LinkedHashMap<>();

    /** Industry benchmark per metric name. */
    private Map<String, Bounds> benchmarks = new LinkedHashMap<>();

    @Data
    public static class SourceProperties {
        private String id;
        private SourceCategory category;
        private double baseWeight;
        /** Initial value; replaced by the persisted accuracy once one exists. */
        private double historicalAccuracy = 1.0;
    }

    @Data
    public static class Bounds {
        private double min;
        private double max;
    }
}
