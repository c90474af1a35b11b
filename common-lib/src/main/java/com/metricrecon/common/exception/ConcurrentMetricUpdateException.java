package com.metricrecon.common.exception;

import com.metricrecon.common.model.MetricKey;

/**
 * Another resolution of the same metric key replaced the current record first.
 */
public class ConcurrentMetricUpdateException extends ReconciliationException {

    public ConcurrentMetricUpdateException(MetricKey key, String message) {
        super(FailureKind.CONCURRENT_UPDATE, String.valueOf(key), message);
    }

    public ConcurrentMetricUpdateException(MetricKey key, String message, Throwable cause) {
        super(FailureKind.CONCURRENT_UPDATE, String.valueOf(key), message, cause);
    }
}
