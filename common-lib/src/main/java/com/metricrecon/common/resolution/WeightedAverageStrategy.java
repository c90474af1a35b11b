package com.metricrecon.common.resolution;

import com.metricrecon.common.model.AuditCode;
import com.metricrecon.common.model.AuditEvent;
import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.scoring.ConfidenceScorer;

import java.util.ArrayList;
import java.util.List;

/**
 * Trust-weighted blend of two or more non-regulatory observations.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code w = baseWeight × historicalAccuracy} per observation; if every weight is zero,
 *       fall back to equal weights (audited).</li>
 *   <li>{@code finalValue = Σ(v × w) / Σ(w)}, clamped into {@code [min(v), max(v)]} against
 *       floating-point drift.</li>
 *   <li>{@code confidence = max(0, scorer − consistencyPenalty)}.</li>
 * </ol>
 *
 * <p>Conflicting values with identical category and weight still blend; there is no
 * "no decision" outcome.
 */
public class WeightedAverageStrategy implements ResolutionStrategy {

    private final ConfidenceScorer scorer;

    public WeightedAverageStrategy(ConfidenceScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public boolean appliesTo(List<SourcedObservation> observations) {
        return observations.size() >= 2;
    }

    @Override
    public StrategyOutcome resolve(List<SourcedObservation> observations, List<Double> history) {
        List<AuditEvent> audit = new ArrayList<>();
        List<Double> values  = new ArrayList<>(observations.size());
        List<Double> weights = new ArrayList<>(observations.size());
        List<Source> sources = new ArrayList<>(observations.size());

        double totalWeight = 0.0;
        for (SourcedObservation s : observations) {
            totalWeight += s.weight();
        }
        boolean equalWeights = totalWeight <= 0.0;
        if (equalWeights) {
            audit.add(new AuditEvent(AuditCode.ZERO_WEIGHT_FALLBACK,
                "all " + observations.size() + " contributors have zero weight; blending with equal weights"));
        }

        double weightedSum = 0.0;
        double weightSum   = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SourcedObservation s : observations) {
            double w = equalWeights ? 1.0 : s.weight();
            values.add(s.value());
            weights.add(w);
            sources.add(s.source());
            weightedSum += s.value() * w;
            weightSum   += w;
            min = Math.min(min, s.value());
            max = Math.max(max, s.value());
        }

        double finalValue = Math.max(min, Math.min(max, weightedSum / weightSum));

        double base    = scorer.score(sources, ConfidenceScorer.historicalConsistency(finalValue, history));
        double penalty = ConfidenceScorer.consistencyPenalty(values, weights, finalValue);
        if (penalty > 0.0) {
            audit.add(new AuditEvent(AuditCode.CONSISTENCY_PENALTY_APPLIED,
                String.format("confidence %.4f reduced by %.4f for source disagreement", base, penalty)));
        }
        double confidence = Math.max(0.0, base - penalty);

        List<ContributingSource> contributors = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            contributors.add(observations.get(i).toContributor(weights.get(i), false));
        }
        return new StrategyOutcome(ResolutionMethod.WEIGHTED_AVERAGE, finalValue, confidence, contributors, audit);
    }
}
