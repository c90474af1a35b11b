package com.metricrecon.reconciliation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("source_accuracy_log")
public class SourceAccuracyLogRecord {

    @Id
    private Long id;

    private String sourceId;

    private double previousAccuracy;

    private double newAccuracy;

    private double requestedDelta;

    private String reason;

    private LocalDateTime adjustedAt;
}
