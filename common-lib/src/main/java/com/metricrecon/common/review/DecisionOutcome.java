package com.metricrecon.common.review;

import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.ReviewTask;

import java.util.List;

/**
 * A decided review task together with the accuracy changes it caused.
 */
public record DecisionOutcome(ReviewTask task, List<AccuracyAdjustment> adjustments) {

    public DecisionOutcome {
        adjustments = List.copyOf(adjustments);
    }
}
