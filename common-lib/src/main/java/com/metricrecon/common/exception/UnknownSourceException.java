package com.metricrecon.common.exception;

/**
 * Raised by the source registry for a source id that was never registered.
 * The resolver recovers by dropping the observation; it is fatal only for direct lookups.
 */
public class UnknownSourceException extends ReconciliationException {

    public UnknownSourceException(String sourceId) {
        super(FailureKind.UNKNOWN_SOURCE, sourceId, "source is not registered");
    }
}
