package com.metricrecon.common.resolution;

import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.Observation;
import com.metricrecon.common.model.Source;

import java.time.Instant;
import java.util.Comparator;

/**
 * An observation paired with the registry snapshot of its source, taken once per resolution run.
 */
public record SourcedObservation(Observation observation, Source source) {

    /**
     * Normalised order applied before any order-sensitive step: source id, capture time, value.
     */
    public static final Comparator<SourcedObservation> NORMALISED_ORDER =
        Comparator.comparing((SourcedObservation s) -> s.source().sourceId())
            .thenComparing(s -> s.observation().observedAt(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingDouble(SourcedObservation::value);

    public double value() {
        return observation.value();
    }

    public double weight() {
        return source.effectiveWeight();
    }

    public ContributingSource toContributor(double weight, boolean discarded) {
        return new ContributingSource(source.sourceId(), source.category(), observation.value(),
                                      weight, observation.observedAt(), discarded);
    }
}
