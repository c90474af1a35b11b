package com.metricrecon.common.exception;

import com.metricrecon.common.model.ReviewStatus;

public class ReviewAlreadyDecidedException extends ReconciliationException {

    private final ReviewStatus status;

    public ReviewAlreadyDecidedException(String taskId, ReviewStatus status) {
        super(FailureKind.REVIEW_CLOSED, taskId, "review task already closed status=" + status);
        this.status = status;
    }

    public ReviewStatus getStatus() {
        return status;
    }
}
