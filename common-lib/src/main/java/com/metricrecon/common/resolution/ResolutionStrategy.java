package com.metricrecon.common.resolution;

import java.util.List;

/**
 * One branch of the resolution decision tree.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — safe to call concurrently for independent metric keys</li>
 *   <li><b>Deterministic</b> — input arrives in {@link SourcedObservation#NORMALISED_ORDER};
 *       output must not depend on anything else</li>
 *   <li><b>Total</b> — when {@link #appliesTo} is true, {@link #resolve} always yields a value</li>
 * </ul>
 *
 * <p>{@link ConflictResolver} asks strategies in precedence order: regulatory override,
 * single source, weighted average.
 */
public interface ResolutionStrategy {

    boolean appliesTo(List<SourcedObservation> observations);

    /**
     * @param observations non-empty, normalised, every source registered
     * @param history      the entity's trailing values for the metric (may be empty)
     */
    StrategyOutcome resolve(List<SourcedObservation> observations, List<Double> history);
}
