package com.metricrecon.common.engine;

import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewTask;

import java.util.Optional;

/**
 * A resolved metric and, when one was raised, its review task.
 */
public record Resolution(ResolvedMetric metric, ReviewTask reviewTask) {

    public Optional<ReviewTask> review() {
        return Optional.ofNullable(reviewTask);
    }
}
