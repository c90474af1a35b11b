package com.metricrecon.common.model;

/**
 * How a {@link ResolvedMetric}'s final value was obtained.
 *
 * <ul>
 *   <li>{@link #OVERRIDE}            — a regulatory observation taken verbatim.</li>
 *   <li>{@link #SINGLE_SOURCE}       — the only non-regulatory observation taken verbatim.</li>
 *   <li>{@link #WEIGHTED_AVERAGE}    — trust-weighted blend of two or more observations.</li>
 *   <li>{@link #REVIEWER_CORRECTION} — value supplied by a human reviewer.</li>
 * </ul>
 */
public enum ResolutionMethod {
    OVERRIDE,
    WEIGHTED_AVERAGE,
    SINGLE_SOURCE,
    REVIEWER_CORRECTION
}
