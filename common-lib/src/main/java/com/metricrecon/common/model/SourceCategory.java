package com.metricrecon.common.model;

/**
 * Trust tier of a data provider.
 *
 * <ul>
 *   <li>{@link #REGULATORY}             — regulatory filings; treated as ground truth.</li>
 *   <li>{@link #MULTI_SOURCE_AGGREGATE} — aggregators that already blend several feeds.</li>
 *   <li>{@link #SINGLE_RELIABLE}        — one reputable provider.</li>
 *   <li>{@link #PREDICTIVE}             — analyst estimates and other forward-looking feeds.</li>
 * </ul>
 */
public enum SourceCategory {
    REGULATORY,
    MULTI_SOURCE_AGGREGATE,
    SINGLE_RELIABLE,
    PREDICTIVE
}
