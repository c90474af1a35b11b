package com.metricrecon.reconciliation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted {@link com.metricrecon.common.model.ResolvedMetric}. Rows are never updated in place
 * except to set {@code supersededBy}: a re-resolution or a reviewer correction inserts a new row
 * and points the previous current row at it.
 *
 * payload — JSON-serialised {@code ResolvedMetric} (contributors, anomalies, audit trail)
 */
@Data
@NoArgsConstructor
@Table("resolved_metrics")
public class ResolvedMetricRecord {

    @Id
    private Long id;

    private String metricName;

    private String entityId;

    private String period;

    private double finalValue;

    private double confidence;

    private String resolutionMethod;

    private double qualityScore;

    private String qualityGrade;

    /** JSON-serialised {@code ResolvedMetric} */
    private String payload;

    /** Id of the row that replaced this one; null while current. */
    private Long supersededBy;

    private LocalDateTime resolvedAt;
}
