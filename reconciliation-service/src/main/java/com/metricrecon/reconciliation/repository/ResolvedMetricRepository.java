package com.metricrecon.reconciliation.repository;

import com.metricrecon.reconciliation.model.ResolvedMetricRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ResolvedMetricRepository extends ReactiveCrudRepository<ResolvedMetricRecord, Long> {

    /**
     * The current (not superseded) record for one metric/entity/period, if any.
     */
    @Query("""
        SELECT * FROM resolved_metrics
        WHERE metric_name = :metricName
          AND entity_id   = :entityId
          AND period      = :period
          AND superseded_by IS NULL
        ORDER BY id DESC
        LIMIT 1
        """)
    Mono<ResolvedMetricRecord> findCurrent(String metricName, String entityId, String period);

    /**
     * Current records of earlier periods, newest period first. Periods compare as strings,
     * so they must share one sortable format (e.g. {@code 2024Q1}, {@code 2024-03}).
     */
    @Query("""
        SELECT * FROM resolved_metrics
        WHERE metric_name = :metricName
          AND entity_id   = :entityId
          AND period      < :period
          AND superseded_by IS NULL
        ORDER BY period DESC
        LIMIT :limit
        """)
    Flux<ResolvedMetricRecord> findTrailing(String metricName, String entityId, String period, int limit);

    /** Reserves the id of the next record so the previous one can point at it before the insert. */
    @Query("SELECT nextval('resolved_metrics_id_seq')")
    Mono<Long> nextId();

    @Modifying
    @Query("""
        INSERT INTO resolved_metrics
            (id, metric_name, entity_id, period, final_value, confidence, resolution_method,
             quality_score, quality_grade, payload, superseded_by, resolved_at)
        VALUES
            (:id, :metricName, :entityId, :period, :finalValue, :confidence, :resolutionMethod,
             :qualityScore, :qualityGrade, :payload, NULL, :resolvedAt)
        """)
    Mono<Integer> insertCurrent(Long id, String metricName, String entityId, String period,
                                double finalValue, double confidence, String resolutionMethod,
                                double qualityScore, String qualityGrade, String payload,
                                LocalDateTime resolvedAt);

    /**
     * @return 1, or 0 when another writer superseded the record first
     */
    @Modifying
    @Query("""
        UPDATE resolved_metrics
        SET superseded_by = :supersededBy
        WHERE id = :id AND superseded_by IS NULL
        """)
    Mono<Integer> markSuperseded(Long id, Long supersededBy);
}
