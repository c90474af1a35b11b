package com.metricrecon.common.resolution;

import com.metricrecon.common.anomaly.AnomalyDetector;
import com.metricrecon.common.anomaly.AnomalyReport;
import com.metricrecon.common.exception.EmptyObservationSetException;
import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.AuditCode;
import com.metricrecon.common.model.AuditEvent;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.Observation;
import com.metricrecon.common.model.ResolutionContext;
import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.scoring.ConfidenceScorer;
import com.metricrecon.common.scoring.DataQualityScorer;
import com.metricrecon.common.scoring.QualityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns every observation of one metric/entity/period into a single {@link ResolvedMetric}.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Sort the raw input so audit entries never depend on arrival order.</li>
 *   <li>Drop observations for another key, with non-finite values, or from unregistered sources
 *       (each drop audited; unknown sources also logged at WARN).</li>
 *   <li>Nothing left → {@link EmptyObservationSetException}.</li>
 *   <li>First applicable {@link ResolutionStrategy}: override → single source → weighted average.</li>
 *   <li>Anomaly detection on the final value; HIGH caps non-override confidence at
 *       {@value #HIGH_SEVERITY_CONFIDENCE_CAP}.</li>
 *   <li>Data quality grading.</li>
 * </ol>
 *
 * <p>A pure function of its arguments and the registry snapshot it reads: the same inputs produce
 * an equal record. Thread-safe.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public static final double HIGH_SEVERITY_CONFIDENCE_CAP = 0.5;

    private static final Comparator<Observation> RAW_ORDER =
        Comparator.comparing(Observation::sourceId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Observation::observedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingDouble(Observation::value);

    private final SourceRegistry registry;
    private final AnomalyDetector anomalyDetector;
    private final DataQualityScorer qualityScorer;
    private final List<ResolutionStrategy> strategies;

    public ConflictResolver(SourceRegistry registry,
                            ConfidenceScorer confidenceScorer,
                            AnomalyDetector anomalyDetector,
                            DataQualityScorer qualityScorer) {
        this.registry        = registry;
        this.anomalyDetector = anomalyDetector;
        this.qualityScorer   = qualityScorer;
        this.strategies      = List.of(
            new RegulatoryOverrideStrategy(),
            new SingleSourceStrategy(confidenceScorer),
            new WeightedAverageStrategy(confidenceScorer));
    }

    public ResolvedMetric resolve(MetricKey key, List<Observation> observations, ResolutionContext context) {
        List<AuditEvent> audit = new ArrayList<>();
        List<SourcedObservation> usable = normalise(key, observations, audit);
        if (usable.isEmpty()) {
            throw new EmptyObservationSetException(key, audit.size());
        }

        StrategyOutcome outcome = strategies.stream()
            .filter(s -> s.appliesTo(usable))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("no resolution strategy for " + usable.size() + " observations"))
            .resolve(usable, context.history());
        audit.addAll(outcome.audit());

        AnomalyReport anomalies = anomalyDetector.detect(
            key.metricName(), outcome.finalValue(), context.history(), context.benchmark());
        audit.addAll(anomalies.skipped());

        double confidence = outcome.confidence();
        if (anomalies.maxSeverity() == AnomalySeverity.HIGH
                && outcome.method() != ResolutionMethod.OVERRIDE
                && confidence > HIGH_SEVERITY_CONFIDENCE_CAP) {
            audit.add(new AuditEvent(AuditCode.CONFIDENCE_CAPPED, String.format(
                "HIGH anomaly caps confidence %.4f→%.2f", confidence, HIGH_SEVERITY_CONFIDENCE_CAP)));
            confidence = HIGH_SEVERITY_CONFIDENCE_CAP;
        }

        QualityScore quality = qualityScorer.score(outcome.contributors(), anomalies.maxSeverity(),
            ConfidenceScorer.historicalConsistency(outcome.finalValue(), context.history()), context.asOf());

        ResolvedMetric resolved = new ResolvedMetric(
            key.metricName(), key.entityId(), key.period(),
            outcome.finalValue(), confidence, outcome.method(),
            outcome.contributors(), anomalies.findings(),
            quality.score(), quality.grade(), audit);

        log.debug("Resolved. key={} method={} value={} confidence={} grade={} anomalies={}",
                  key, resolved.resolutionMethod(), resolved.finalValue(), resolved.confidence(),
                  resolved.qualityGrade(), resolved.anomalies().size());
        return resolved;
    }

    private List<SourcedObservation> normalise(MetricKey key, List<Observation> observations, List<AuditEvent> audit) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        List<Observation> sorted = observations.stream()
            .filter(o -> o != null)
            .sorted(RAW_ORDER)
            .toList();

        List<SourcedObservation> usable = new ArrayList<>(sorted.size());
        for (Observation o : sorted) {
            if (!key.equals(safeKey(o))) {
                audit.add(new AuditEvent(AuditCode.KEY_MISMATCH_DROPPED,
                    "observation from " + o.sourceId() + " belongs to " + safeKey(o)));
                continue;
            }
            if (!Double.isFinite(o.value())) {
                audit.add(new AuditEvent(AuditCode.INVALID_VALUE_DROPPED,
                    "non-finite value " + o.value() + " from " + o.sourceId()));
                continue;
            }
            if (!registry.isRegistered(o.sourceId())) {
                log.warn("Observation dropped: unknown source. key={} sourceId={} value={}",
                         key, o.sourceId(), o.value());
                audit.add(new AuditEvent(AuditCode.UNKNOWN_SOURCE_DROPPED,
                    "source " + o.sourceId() + " is not registered; value " + o.value() + " ignored"));
                continue;
            }
            usable.add(new SourcedObservation(o, registry.getSource(o.sourceId())));
        }
        usable.sort(SourcedObservation.NORMALISED_ORDER);
        return usable;
    }

    private static MetricKey safeKey(Observation o) {
        if (o.metricName() == null || o.entityId() == null || o.period() == null) {
            return null;
        }
        return o.key();
    }
}
