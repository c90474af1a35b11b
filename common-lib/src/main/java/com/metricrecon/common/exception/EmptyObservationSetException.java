package com.metricrecon.common.exception;

import com.metricrecon.common.model.MetricKey;

/**
 * No usable observation remained for a resolution. No {@code ResolvedMetric} is produced.
 */
public class EmptyObservationSetException extends ReconciliationException {

    private final transient MetricKey key;
    private final int dropped;

    public EmptyObservationSetException(MetricKey key, int dropped) {
        super(FailureKind.NO_USABLE_DATA, key.toString(), "no usable observations (dropped=" + dropped + ")");
        this.key = key;
        this.dropped = dropped;
    }

    public MetricKey getKey() {
        return key;
    }

    public int getDropped() {
        return dropped;
    }
}
