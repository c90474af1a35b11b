package com.metricrecon.common.model;

public enum ReviewDecision {
    APPROVE,
    REJECT;

    public ReviewStatus resultingStatus() {
        return this == APPROVE ? ReviewStatus.APPROVED : ReviewStatus.REJECTED;
    }
}
