package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one resolution run for a {@link MetricKey}.
 *
 * <ul>
 *   <li>{@code confidence}          — trust in {@code finalValue}, always in [0.0, 1.0].</li>
 *   <li>{@code contributingSources} — every observation that reached the strategy step, in normalised
 *       order; entries with {@code discarded = true} did not influence the value.</li>
 *   <li>{@code anomalies}           — findings of the anomaly detector on {@code finalValue}.</li>
 *   <li>{@code auditTrail}          — what was dropped, skipped or capped on the way.</li>
 * </ul>
 *
 * <p>Carries no identifiers or wall-clock stamps so that reruns over the same inputs compare equal.
 * Supersession is tracked by the store, not here.
 */
public record ResolvedMetric(
    @JsonProperty("metricName")          String                   metricName,
    @JsonProperty("entityId")            String                   entityId,
    @JsonProperty("period")              String                   period,
    @JsonProperty("finalValue")          double                   finalValue,
    @JsonProperty("confidence")          double                   confidence,
    @JsonProperty("resolutionMethod")    ResolutionMethod         resolutionMethod,
    @JsonProperty("contributingSources") List<ContributingSource> contributingSources,
    @JsonProperty("anomalies")           List<AnomalyFinding>     anomalies,
    @JsonProperty("qualityScore")        double                   qualityScore,
    @JsonProperty("qualityGrade")        QualityGrade             qualityGrade,
    @JsonProperty("auditTrail")          List<AuditEvent>         auditTrail
) {

    /** Confidence assigned to a value typed in by a reviewer. */
    public static final double REVIEWER_CORRECTION_CONFIDENCE = 0.9;

    public ResolvedMetric {
        Objects.requireNonNull(resolutionMethod, "resolutionMethod");
        if (contributingSources == null || contributingSources.isEmpty()) {
            throw new IllegalArgumentException("a resolved metric needs at least one contributing observation");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        contributingSources = List.copyOf(contributingSources);
        anomalies  = anomalies  == null ? List.of() : List.copyOf(anomalies);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    @JsonIgnore
    public MetricKey key() {
        return new MetricKey(metricName, entityId, period);
    }

    /** Highest severity across {@link #anomalies()}; {@link AnomalySeverity#NONE} when there are none. */
    @JsonIgnore
    public AnomalySeverity maxSeverity() {
        AnomalySeverity max = AnomalySeverity.NONE;
        for (AnomalyFinding finding : anomalies) {
            max = max.max(finding.severity());
        }
        return max;
    }

    /** Contributors that actually shaped {@code finalValue}. */
    @JsonIgnore
    public List<ContributingSource> activeSources() {
        return contributingSources.stream().filter(c -> !c.discarded()).toList();
    }

    /**
     * Derives the record a reviewer's corrected value produces. Contributors, anomalies and quality
     * are carried over so the history shows what the reviewer was looking at.
     */
    public ResolvedMetric withReviewerCorrection(double correctedValue, String notes) {
        List<AuditEvent> trail = new ArrayList<>(auditTrail);
        trail.add(new AuditEvent(AuditCode.REVIEWER_CORRECTION, String.format(
            "value %s→%s method %s→%s notes=%s",
            finalValue, correctedValue, resolutionMethod, ResolutionMethod.REVIEWER_CORRECTION, notes)));
        return new ResolvedMetric(metricName, entityId, period, correctedValue,
            REVIEWER_CORRECTION_CONFIDENCE, ResolutionMethod.REVIEWER_CORRECTION,
            contributingSources, anomalies, qualityScore, qualityGrade, trail);
    }
}
