package com.metricrecon.common.exception;

/**
 * Invalid engine configuration. Only ever thrown while the registry or range table is built.
 */
public class ReconciliationConfigException extends ReconciliationException {

    public ReconciliationConfigException(String subject, String message) {
        super(FailureKind.INVALID_CONFIGURATION, subject, message);
    }
}
