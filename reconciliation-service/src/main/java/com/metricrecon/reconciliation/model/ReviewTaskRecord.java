package com.metricrecon.reconciliation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted review task, keyed by the engine-assigned task id.
 *
 * payload — JSON-serialised {@code ReviewTask} including the metric under review
 */
@Data
@NoArgsConstructor
@Table("review_tasks")
public class ReviewTaskRecord {

    @Id
    private String taskId;

    private String metricName;

    private String entityId;

    private String period;

    private String priority;

    private String status;

    private String decision;

    private Double correctedValue;

    /** JSON-serialised {@code ReviewTask} */
    private String payload;

    private LocalDateTime createdAt;

    private LocalDateTime decidedAt;
}
