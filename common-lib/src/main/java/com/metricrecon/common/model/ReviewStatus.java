package com.metricrecon.common.model;

/**
 * PENDING until a reviewer decides (APPROVED / REJECTED) or a newer resolution of the same
 * metric key retires the task (SUPERSEDED). Only PENDING tasks accept a decision.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    SUPERSEDED
}
