package com.metricrecon.common.resolution;

import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.scoring.ConfidenceScorer;

import java.util.List;

/**
 * Exactly one non-regulatory observation: its value is passed through untouched.
 */
public class SingleSourceStrategy implements ResolutionStrategy {

    private final ConfidenceScorer scorer;

    public SingleSourceStrategy(ConfidenceScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public boolean appliesTo(List<SourcedObservation> observations) {
        return observations.size() == 1;
    }

    @Override
    public StrategyOutcome resolve(List<SourcedObservation> observations, List<Double> history) {
        SourcedObservation only = observations.get(0);
        double value = only.value();
        double confidence = scorer.score(List.of(only.source()),
            ConfidenceScorer.historicalConsistency(value, history));
        return new StrategyOutcome(ResolutionMethod.SINGLE_SOURCE, value, confidence,
            List.of(only.toContributor(only.weight(), false)), List.of());
    }
}
