package com.metricrecon.common.scoring;

import com.metricrecon.common.model.QualityGrade;

/**
 * Weighted data-quality score with its component breakdown, each component in [0.0, 1.0].
 */
public record QualityScore(
    double       score,
    QualityGrade grade,
    double       sourceReliability,
    double       dataFreshness,
    double       validationStatus,
    double       consistency,
    double       completeness
) {}
