package com.metricrecon.common.resolution;

import com.metricrecon.common.model.AuditEvent;
import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.ResolutionMethod;

import java.util.List;

/**
 * What a {@link ResolutionStrategy} decided, before anomaly capping and quality grading.
 */
public record StrategyOutcome(
    ResolutionMethod         method,
    double                   finalValue,
    double                   confidence,
    List<ContributingSource> contributors,
    List<AuditEvent>         audit
) {

    public StrategyOutcome {
        contributors = List.copyOf(contributors);
        audit        = List.copyOf(audit);
    }
}
