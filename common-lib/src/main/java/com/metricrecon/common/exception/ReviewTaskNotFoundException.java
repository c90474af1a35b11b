package com.metricrecon.common.exception;

public class ReviewTaskNotFoundException extends ReconciliationException {

    public ReviewTaskNotFoundException(String taskId) {
        super(FailureKind.REVIEW_NOT_FOUND, taskId, "review task not found");
    }
}
