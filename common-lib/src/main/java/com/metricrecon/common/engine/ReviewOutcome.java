package com.metricrecon.common.engine;

import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewTask;

import java.util.List;

/**
 * Result of a review decision: the archived task, the metric consumers should now use,
 * whether that metric is a reviewer correction, and the trust changes the decision caused.
 */
public record ReviewOutcome(
    ReviewTask               task,
    ResolvedMetric           metric,
    boolean                  corrected,
    List<AccuracyAdjustment> adjustments
) {}
