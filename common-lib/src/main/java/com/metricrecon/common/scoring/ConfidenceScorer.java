package com.metricrecon.common.scoring;

import com.metricrecon.common.model.Source;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.stats.SeriesStatistics;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stateless calculator for the confidence of a candidate resolved value.
 *
 * <p><b>Formula</b>:
 * <pre>
 *   base                  = min(0.9, 0.5 + 0.1 × (distinctSources − 1))
 *   weightedQuality       = mean(categoryWeight(source)) over distinct sources
 *   historicalConsistency = 1 / (1 + |v − mean(history)| / max(|mean|, stddev))
 *   confidence            = min(0.9, base × weightedQuality × historicalConsistency)
 * </pre>
 *
 * <p><b>Consistency penalty</b> (weighted-average path only):
 * <pre>
 *   penalty = min(0.3, weightedVariance / |finalValue|)      (0 when finalValue = 0)
 * </pre>
 *
 * <p>No randomness and no iteration-order dependence: sources are folded in id order.
 * The fixed {@value #OVERRIDE_CONFIDENCE} of the regulatory path is the only value above the cap.
 */
public final class ConfidenceScorer {

    public static final double MAX_COMPUTED_CONFIDENCE = 0.9;
    public static final double OVERRIDE_CONFIDENCE     = 0.95;
    public static final double MAX_CONSISTENCY_PENALTY = 0.3;

    static final double BASE_CONFIDENCE      = 0.5;
    static final double CORROBORATION_STEP   = 0.1;

    private final SourceRegistry registry;

    public ConfidenceScorer(SourceRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param sources               snapshots of the sources behind the selected observations
     *                              (duplicates allowed; counted once)
     * @param historicalConsistency multiplier from {@link #historicalConsistency}
     * @return confidence in [0.0, {@value #MAX_COMPUTED_CONFIDENCE}]
     */
    public double score(Collection<Source> sources, double historicalConsistency) {
        Map<String, Source> distinct = new TreeMap<>();
        for (Source s : sources) {
            distinct.putIfAbsent(s.sourceId(), s);
        }
        if (distinct.isEmpty()) return 0.0;

        double base = Math.min(MAX_COMPUTED_CONFIDENCE,
            BASE_CONFIDENCE + CORROBORATION_STEP * (distinct.size() - 1));

        double qualitySum = 0.0;
        for (Source s : distinct.values()) {
            qualitySum += registry.categoryWeight(s.category());
        }
        double weightedQuality = qualitySum / distinct.size();

        double confidence = base * weightedQuality * historicalConsistency;
        return Math.max(0.0, Math.min(MAX_COMPUTED_CONFIDENCE, confidence));
    }

    /**
     * Multiplier in [0, 1] expressing how close {@code candidate} sits to the entity's own history.
     * No history → 1.0. A deviation too large to represent as a double → 0.0.
     */
    public static double historicalConsistency(double candidate, List<Double> history) {
        if (history == null || history.isEmpty()) return 1.0;
        double mean  = SeriesStatistics.mean(history);
        double scale = Math.max(Math.abs(mean), SeriesStatistics.stddev(history));
        if (scale == 0.0) {
            return candidate == mean ? 1.0 : 0.5;
        }
        double relativeDeviation = Math.abs(candidate - mean) / scale;
        if (!Double.isFinite(relativeDeviation)) {
            return 0.0;
        }
        return 1.0 / (1.0 + relativeDeviation);
    }

    /**
     * Disagreement penalty for a weighted blend, capped at {@value #MAX_CONSISTENCY_PENALTY}.
     */
    public static double consistencyPenalty(List<Double> values, List<Double> weights, double finalValue) {
        if (finalValue == 0.0) return 0.0;
        double penalty = SeriesStatistics.weightedVariance(values, weights, finalValue) / Math.abs(finalValue);
        if (!Double.isFinite(penalty)) {
            return MAX_CONSISTENCY_PENALTY;
        }
        return Math.min(MAX_CONSISTENCY_PENALTY, penalty);
    }
}
