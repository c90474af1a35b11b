package com.metricrecon.common.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * External inputs of a resolution besides the observations themselves.
 *
 * <ul>
 *   <li>{@code history}   — the entity's trailing final values for the metric, oldest first.</li>
 *   <li>{@code benchmark} — industry range, or {@code null} when none is known.</li>
 *   <li>{@code asOf}      — evaluation instant used for freshness decay.</li>
 * </ul>
 */
public record ResolutionContext(List<Double> history, BenchmarkRange benchmark, Instant asOf) {

    public ResolutionContext {
        history = history == null ? List.of() : List.copyOf(history);
        Objects.requireNonNull(asOf, "asOf");
    }

    public static ResolutionContext withoutHistory(Instant asOf) {
        return new ResolutionContext(List.of(), null, asOf);
    }
}
