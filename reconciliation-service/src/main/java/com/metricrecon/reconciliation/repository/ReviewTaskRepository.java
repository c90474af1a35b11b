package com.metricrecon.reconciliation.repository;

import com.metricrecon.reconciliation.model.ReviewTaskRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ReviewTaskRepository extends ReactiveCrudRepository<ReviewTaskRecord, String> {

    /**
     * Inserts a newly raised task or overwrites it with its decided state.
     */
    @Modifying
    @Query("""
        INSERT INTO review_tasks
            (task_id, metric_name, entity_id, period, priority, status,
             decision, corrected_value, payload, created_at, decided_at)
        VALUES
            (:taskId, :metricName, :entityId, :period, :priority, :status,
             :decision, :correctedValue, :payload, :createdAt, :decidedAt)
        ON CONFLICT (task_id) DO UPDATE SET
            status          = EXCLUDED.status,
            decision        = EXCLUDED.decision,
            corrected_value = EXCLUDED.corrected_value,
            payload         = EXCLUDED.payload,
            decided_at      = EXCLUDED.decided_at
        """)
    Mono<Void> upsertTask(String taskId, String metricName, String entityId, String period,
                          String priority, String status, String decision, Double correctedValue,
                          String payload, LocalDateTime createdAt, LocalDateTime decidedAt);

    Flux<ReviewTaskRecord> findByStatus(String status);

    /**
     * Writes a reviewer's verdict onto a task that is still pending.
     *
     * @return 1, or 0 when the task is missing or already closed
     */
    @Modifying
    @Query("""
        UPDATE review_tasks SET
            status          = :status,
            decision        = :decision,
            corrected_value = :correctedValue,
            payload         = :payload,
            decided_at      = :decidedAt
        WHERE task_id = :taskId AND status = 'PENDING'
        """)
    Mono<Integer> decidePending(String taskId, String status, String decision, Double correctedValue,
                                String payload, LocalDateTime decidedAt);

    /**
     * Retires every pending task of one metric key except {@code keepTaskId}. The payload keeps its
     * PENDING snapshot; {@code status} is authoritative.
     */
    @Modifying
    @Query("""
        UPDATE review_tasks SET
            status     = 'SUPERSEDED',
            decided_at = :decidedAt
        WHERE metric_name = :metricName
          AND entity_id   = :entityId
          AND period      = :period
          AND status      = 'PENDING'
          AND task_id    <> :keepTaskId
        """)
    Mono<Integer> retirePending(String metricName, String entityId, String period,
                                String keepTaskId, LocalDateTime decidedAt);
}
