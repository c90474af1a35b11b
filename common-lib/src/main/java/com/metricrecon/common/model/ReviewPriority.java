package com.metricrecon.common.model;

/**
 * Declared most-urgent first; queue ordering relies on the ordinal.
 */
public enum ReviewPriority {
    URGENT,
    NORMAL,
    LOW
}
