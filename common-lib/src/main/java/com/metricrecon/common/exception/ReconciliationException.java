package com.metricrecon.common.exception;

/**
 * Base of every failure raised by the resolution engine and its persistence layer.
 *
 * <p>{@code kind} classifies the failure; {@code subject} names what it is about (a source id,
 * a metric key, a task id) and is prefixed to the message so log lines stay greppable.
 */
public class ReconciliationException extends RuntimeException {

    private final FailureKind kind;
    private final String subject;

    public ReconciliationException(FailureKind kind, String subject, String message) {
        super(kind + " [" + subject + "] " + message);
        this.kind = kind;
        this.subject = subject;
    }

    public ReconciliationException(FailureKind kind, String subject, String message, Throwable cause) {
        super(kind + " [" + subject + "] " + message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    /** True when retrying the same request later may succeed. */
    public boolean isRetryable() {
        return kind == FailureKind.CONCURRENT_UPDATE;
    }
}
