package com.metricrecon.common.model;

/**
 * Everything a resolution skipped, dropped or adjusted. Downstream consumers read these
 * from {@link ResolvedMetric#auditTrail()} to see what a value is missing.
 */
public enum AuditCode {
    KEY_MISMATCH_DROPPED,
    INVALID_VALUE_DROPPED,
    UNKNOWN_SOURCE_DROPPED,
    ZERO_WEIGHT_FALLBACK,
    RANGE_CHECK_SKIPPED,
    ANOMALY_DETECTION_DEGRADED,
    TREND_CHECK_ZERO_VARIANCE,
    PEER_CHECK_SKIPPED,
    CONSISTENCY_PENALTY_APPLIED,
    CONFIDENCE_CAPPED,
    REVIEWER_CORRECTION
}
