package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Human-review work item raised for a low-confidence or anomalous {@link ResolvedMetric}.
 * {@code decision}, {@code reviewerNotes}, {@code correctedValue} and {@code decidedAt}
 * stay {@code null} while the task is {@link ReviewStatus#PENDING}.
 */
public record ReviewTask(
    @JsonProperty("taskId")         String         taskId,
    @JsonProperty("metric")         ResolvedMetric metric,
    @JsonProperty("priority")       ReviewPriority priority,
    @JsonProperty("status")         ReviewStatus   status,
    @JsonProperty("decision")       ReviewDecision decision,
    @JsonProperty("reviewerNotes")  String         reviewerNotes,
    @JsonProperty("correctedValue") Double         correctedValue,
    @JsonProperty("createdAt")      Instant        createdAt,
    @JsonProperty("decidedAt")      Instant        decidedAt
) {

    public static ReviewTask pending(String taskId, ResolvedMetric metric,
                                     ReviewPriority priority, Instant createdAt) {
        return new ReviewTask(taskId, metric, priority, ReviewStatus.PENDING,
                              null, null, null, createdAt, null);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    public ReviewTask decided(ReviewDecision decision, String notes, Double correctedValue, Instant at) {
        return new ReviewTask(taskId, metric, priority, decision.resultingStatus(),
                              decision, notes, correctedValue, createdAt, at);
    }

    /** Retired without a decision because a newer resolution of the same key replaced the metric. */
    public ReviewTask superseded(Instant at) {
        return new ReviewTask(taskId, metric, priority, ReviewStatus.SUPERSEDED,
                              null, null, null, createdAt, at);
    }

    /** The pending task a decision was taken on, for undoing a decision that could not be stored. */
    public ReviewTask reopened() {
        return pending(taskId, metric, priority, createdAt);
    }

    @JsonIgnore
    public MetricKey key() {
        return metric.key();
    }
}
