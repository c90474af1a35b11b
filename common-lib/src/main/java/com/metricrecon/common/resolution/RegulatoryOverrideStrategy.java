package com.metricrecon.common.resolution;

import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.scoring.ConfidenceScorer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Regulatory filings are ground truth: if any observation comes from a
 * {@link com.metricrecon.common.model.SourceCategory#REGULATORY} source its value is taken verbatim
 * with confidence {@value ConfidenceScorer#OVERRIDE_CONFIDENCE}; every other observation is kept
 * as a discarded contributor.
 *
 * <p>Several regulatory observations: highest effective weight wins, then the latest capture,
 * then the smallest source id, then the smallest value.
 */
public class RegulatoryOverrideStrategy implements ResolutionStrategy {

    static final Comparator<SourcedObservation> WINNER_ORDER =
        Comparator.comparingDouble(SourcedObservation::weight).reversed()
            .thenComparing(s -> s.observation().observedAt(),
                Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(s -> s.source().sourceId())
            .thenComparingDouble(SourcedObservation::value);

    @Override
    public boolean appliesTo(List<SourcedObservation> observations) {
        return observations.stream().anyMatch(s -> s.source().isRegulatory());
    }

    @Override
    public StrategyOutcome resolve(List<SourcedObservation> observations, List<Double> history) {
        SourcedObservation winner = observations.stream()
            .filter(s -> s.source().isRegulatory())
            .min(WINNER_ORDER)
            .orElseThrow(() -> new IllegalStateException("override applied without a regulatory observation"));

        List<ContributingSource> contributors = new ArrayList<>(observations.size());
        for (SourcedObservation s : observations) {
            contributors.add(s.toContributor(s.weight(), s != winner));
        }
        return new StrategyOutcome(ResolutionMethod.OVERRIDE, winner.value(),
            ConfidenceScorer.OVERRIDE_CONFIDENCE, contributors, List.of());
    }
}
