package com.metricrecon.common.scoring;

import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.QualityGrade;
import com.metricrecon.common.stats.SeriesStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregates the reliability of a resolved record into one grade.
 *
 * <pre>
 *   score = sourceReliability × 0.30
 *         + dataFreshness     × 0.20
 *         + validationStatus  × 0.25
 *         + consistency       × 0.15
 *         + completeness      × 0.10
 * </pre>
 *
 * <ul>
 *   <li>sourceReliability — mean weight of the non-discarded contributors.</li>
 *   <li>dataFreshness     — {@code 0.5^(age / halfLife)}, age of the newest contributor at {@code asOf}.</li>
 *   <li>validationStatus  — 1.0 clean, 0.6 MEDIUM finding, 0.2 HIGH finding.</li>
 *   <li>consistency       — cross-source agreement × historical consistency.</li>
 *   <li>completeness      — distinct contributors / expected source count, capped at 1.</li>
 * </ul>
 */
public final class DataQualityScorer {

    static final double RELIABILITY_WEIGHT  = 0.30;
    static final double FRESHNESS_WEIGHT    = 0.20;
    static final double VALIDATION_WEIGHT   = 0.25;
    static final double CONSISTENCY_WEIGHT  = 0.15;
    static final double COMPLETENESS_WEIGHT = 0.10;

    public static final Duration DEFAULT_HALF_LIFE      = Duration.ofDays(90);
    public static final int      DEFAULT_EXPECTED_COUNT = 3;

    private final Duration halfLife;
    private final int expectedSourceCount;

    public DataQualityScorer(Duration halfLife, int expectedSourceCount) {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("freshness half-life must be positive");
        }
        if (expectedSourceCount < 1) {
            throw new IllegalArgumentException("expected source count must be at least 1");
        }
        this.halfLife            = halfLife;
        this.expectedSourceCount = expectedSourceCount;
    }

    public DataQualityScorer() {
        this(DEFAULT_HALF_LIFE, DEFAULT_EXPECTED_COUNT);
    }

    public QualityScore score(List<ContributingSource> contributors,
                              AnomalySeverity maxSeverity,
                              double historicalConsistency,
                              Instant asOf) {
        List<ContributingSource> active = contributors.stream().filter(c -> !c.discarded()).toList();

        double reliability  = clamp(active.stream().mapToDouble(ContributingSource::weight).average().orElse(0.0));
        double freshness    = freshness(active, asOf);
        double validation   = validationStatus(maxSeverity);
        double consistency  = clamp(agreement(active) * historicalConsistency);
        double completeness = Math.min(1.0,
            (double) active.stream().map(ContributingSource::sourceId).distinct().count() / expectedSourceCount);

        double score = reliability  * RELIABILITY_WEIGHT
                     + freshness    * FRESHNESS_WEIGHT
                     + validation   * VALIDATION_WEIGHT
                     + consistency  * CONSISTENCY_WEIGHT
                     + completeness * COMPLETENESS_WEIGHT;

        return new QualityScore(score, QualityGrade.fromScore(score),
                                reliability, freshness, validation, consistency, completeness);
    }

    double freshness(List<ContributingSource> active, Instant asOf) {
        Instant newest = active.stream()
            .map(ContributingSource::observedAt)
            .filter(t -> t != null)
            .max(Instant::compareTo)
            .orElse(null);
        if (newest == null) return 0.0;
        long ageMillis = Math.max(0L, Duration.between(newest, asOf).toMillis());
        return Math.pow(0.5, (double) ageMillis / halfLife.toMillis());
    }

    static double validationStatus(AnomalySeverity maxSeverity) {
        if (maxSeverity == null) return 1.0;
        return switch (maxSeverity) {
            case NONE   -> 1.0;
            case MEDIUM -> 0.6;
            case HIGH   -> 0.2;
        };
    }

    static double agreement(List<ContributingSource> active) {
        if (active.size() < 2) return 1.0;
        List<Double> values = active.stream().map(ContributingSource::value).toList();
        double mean = SeriesStatistics.mean(values);
        double sd   = SeriesStatistics.stddev(values);
        if (mean == 0.0) return sd == 0.0 ? 1.0 : 0.0;
        double spread = sd / Math.abs(mean);
        return Double.isFinite(spread) ? 1.0 - Math.min(1.0, spread) : 0.0;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
