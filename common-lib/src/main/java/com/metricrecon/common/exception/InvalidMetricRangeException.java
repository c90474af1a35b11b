package com.metricrecon.common.exception;

public class InvalidMetricRangeException extends ReconciliationConfigException {

    public InvalidMetricRangeException(String metricName, double min, double max) {
        super(metricName, String.format("invalid range min=%s max=%s", min, max));
    }
}
