package com.metricrecon.reconciliation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Last known trust state of a source. Category and base weight always come from configuration;
 * only {@code historicalAccuracy} is read back at startup.
 */
@Data
@NoArgsConstructor
@Table("sources")
public class SourceTrustRecord {

    @Id
    private String sourceId;

    private String category;

    private double baseWeight;

    private double historicalAccuracy;

    private LocalDateTime updatedAt;
}
