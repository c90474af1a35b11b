package com.metricrecon.common.exception;

/**
 * What went wrong, independent of which component noticed it. Callers map a kind to their own
 * error surface (an HTTP status, a batch item error) without knowing every subclass.
 */
public enum FailureKind {
    /** Deployment settings are unusable; raised only while the engine is built. */
    INVALID_CONFIGURATION,
    /** A source id that was never registered. */
    UNKNOWN_SOURCE,
    /** Nothing usable was left to resolve. */
    NO_USABLE_DATA,
    /** A review task id that was never queued. */
    REVIEW_NOT_FOUND,
    /** The review task is already decided or was retired by a newer resolution. */
    REVIEW_CLOSED,
    /** Another resolution of the same metric key won a concurrent write. */
    CONCURRENT_UPDATE,
    /** A stored record could not be written or read back. */
    PERSISTENCE
}
