package com.metricrecon.reconciliation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricrecon.common.engine.ReviewOutcome;
import com.metricrecon.common.exception.ConcurrentMetricUpdateException;
import com.metricrecon.common.exception.FailureKind;
import com.metricrecon.common.exception.ReconciliationException;
import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.exception.ReviewTaskNotFoundException;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewStatus;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.reconciliation.model.ResolvedMetricRecord;
import com.metricrecon.reconciliation.model.SourceAccuracyLogRecord;
import com.metricrecon.reconciliation.model.SourceTrustRecord;
import com.metricrecon.reconciliation.repository.ResolvedMetricRepository;
import com.metricrecon.reconciliation.repository.ReviewTaskRepository;
import com.metricrecon.reconciliation.repository.SourceAccuracyLogRepository;
import com.metricrecon.reconciliation.repository.SourceTrustRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of engine output: resolved metrics with their supersede chain, review tasks,
 * source trust and the accuracy log. Structured payloads are stored as JSON next to the
 * columns used for lookup.
 *
 * <h3>Write units</h3>
 * <pre>
 *   persistResolution — new current record, previous one superseded, other pending tasks of the
 *                       key retired, new task (if any) inserted
 *   persistDecision   — task decided (only if still pending), accuracy log and trust, reviewer
 *                       correction as a new current record
 * </pre>
 * Each unit runs in one transaction. A current record is replaced only if it is still current
 * ({@code markSuperseded} returns 1) and the unique partial index on the key rejects a second
 * current row; both surface as {@link ConcurrentMetricUpdateException}, and the whole unit is
 * retried up to {@value #CONCURRENT_UPDATE_RETRIES} times against the new current record.
 */
@Service
public class ReconciliationStore {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationStore.class);

    static final int CONCURRENT_UPDATE_RETRIES = 3;

    /** Task id that matches no task, for retiring every pending task of a key. */
    private static final String NO_TASK = "";

    private final ResolvedMetricRepository metricRepository;
    private final ReviewTaskRepository taskRepository;
    private final SourceTrustRepository trustRepository;
    private final SourceAccuracyLogRepository accuracyLogRepository;
    private final SourceRegistry registry;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReconciliationStore(ResolvedMetricRepository metricRepository,
                               ReviewTaskRepository taskRepository,
                               SourceTrustRepository trustRepository,
                               SourceAccuracyLogRepository accuracyLogRepository,
                               SourceRegistry registry,
                               TransactionalOperator transactionalOperator,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.metricRepository      = metricRepository;
        this.taskRepository        = taskRepository;
        this.trustRepository       = trustRepository;
        this.accuracyLogRepository = accuracyLogRepository;
        this.registry              = registry;
        this.transactionalOperator = transactionalOperator;
        this.objectMapper          = objectMapper;
        this.clock                 = clock;
    }

    // ── write units ──────────────────────────────────────────────────────────

    /**
     * Stores a resolution: {@code metric} becomes the current record of its key, and {@code task},
     * when not {@code null}, becomes the key's only pending review task.
     */
    public Mono<ResolvedMetricRecord> persistResolution(ResolvedMetric metric, ReviewTask task) {
        MetricKey key = metric.key();
        String keep = task != null ? task.taskId() : NO_TASK;
        Mono<ResolvedMetricRecord> unit = Mono.defer(() -> insertCurrent(metric)
            .flatMap(saved -> taskRepository.retirePending(key.metricName(), key.entityId(), key.period(),
                                                           keep, LocalDateTime.now(clock))
                .doOnNext(retired -> {
                    if (retired > 0) {
                        log.info("Pending review tasks retired. key={} count={} replacedBy={}",
                                 key, retired, task != null ? task.taskId() : null);
                    }
                })
                .then(task != null ? upsertTask(task) : Mono.<Void>empty())
                .thenReturn(saved)));
        return transactionalOperator.transactional(unit)
            .retryWhen(concurrentUpdateRetry(key))
            .doOnError(e -> log.error("Failed to persist resolution. key={} error={}", key, e.getMessage()));
    }

    /**
     * Stores a review decision. Fails with {@link ReviewAlreadyDecidedException} when the stored
     * task is no longer pending, so a decision taken elsewhere is never overwritten.
     */
    public Mono<Void> persistDecision(ReviewOutcome outcome) {
        ReviewTask task = outcome.task();
        Mono<Void> unit = Mono.defer(() -> decidePending(task)
            .then(saveAdjustments(outcome.adjustments()))
            .then(outcome.corrected() ? insertCurrent(outcome.metric()).then() : Mono.<Void>empty()));
        return transactionalOperator.transactional(unit)
            .retryWhen(concurrentUpdateRetry(task.key()))
            .doOnSuccess(v -> log.debug("Review decision persisted. taskId={} status={}", task.taskId(), task.status()))
            .doOnError(e -> log.error("Failed to persist review decision. taskId={} error={}",
                                      task.taskId(), e.getMessage()));
    }

    // ── resolved metrics ─────────────────────────────────────────────────────

    /**
     * Inserts {@code metric} as the new current record of its key, pointing the previous current
     * record at it first. Must run inside a transaction: the supersede link is checked at commit.
     */
    private Mono<ResolvedMetricRecord> insertCurrent(ResolvedMetric metric) {
        MetricKey key = metric.key();
        return Mono.fromCallable(() -> toEntity(metric))
            .flatMap(entity -> metricRepository.findCurrent(key.metricName(), key.entityId(), key.period())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(previous -> metricRepository.nextId()
                    .flatMap(id -> {
                        entity.setId(id);
                        Mono<Void> unlink = previous
                            .map(p -> supersede(key, p.getId(), id))
                            .orElseGet(Mono::empty);
                        return unlink.then(Mono.defer(() -> insert(entity))).thenReturn(entity);
                    })
                    .doOnSuccess(saved -> log.info("Resolved metric persisted. id={} key={} method={} supersedes={}",
                        saved.getId(), key, saved.getResolutionMethod(),
                        previous.map(ResolvedMetricRecord::getId).orElse(null)))))
            .onErrorMap(DataIntegrityViolationException.class,
                e -> new ConcurrentMetricUpdateException(key, "another current record was inserted first", e));
    }

    private Mono<Void> supersede(MetricKey key, Long previousId, Long id) {
        return metricRepository.markSuperseded(previousId, id)
            .flatMap(rows -> rows == 1
                ? Mono.<Void>empty()
                : Mono.<Void>error(new ConcurrentMetricUpdateException(key,
                    "record " + previousId + " was superseded by another writer")));
    }

    private Mono<Void> insert(ResolvedMetricRecord e) {
        return metricRepository.insertCurrent(e.getId(), e.getMetricName(), e.getEntityId(), e.getPeriod(),
                e.getFinalValue(), e.getConfidence(), e.getResolutionMethod(),
                e.getQualityScore(), e.getQualityGrade(), e.getPayload(), e.getResolvedAt())
            .then();
    }

    private static Retry concurrentUpdateRetry(MetricKey key) {
        return Retry.max(CONCURRENT_UPDATE_RETRIES)
            .filter(e -> e instanceof ReconciliationException && ((ReconciliationException) e).isRetryable())
            .doBeforeRetry(signal -> log.warn("Concurrent update; retrying. key={} attempt={}",
                                              key, signal.totalRetries() + 1))
            .onRetryExhaustedThrow((retry, signal) -> signal.failure());
    }

    public Mono<ResolvedMetric> currentMetric(MetricKey key) {
        return metricRepository.findCurrent(key.metricName(), key.entityId(), key.period())
            .map(record -> fromJson(record.getPayload(), ResolvedMetric.class));
    }

    /**
     * Final values of the current records of earlier periods, oldest first.
     */
    public Mono<List<Double>> trailingHistory(MetricKey key, int limit) {
        if (limit <= 0) {
            return Mono.just(List.of());
        }
        return metricRepository.findTrailing(key.metricName(), key.entityId(), key.period(), limit)
            .map(ResolvedMetricRecord::getFinalValue)
            .collectList()
            .map(newestFirst -> {
                List<Double> oldestFirst = new ArrayList<>(newestFirst);
                Collections.reverse(oldestFirst);
                return oldestFirst;
            });
    }

    // ── review tasks ─────────────────────────────────────────────────────────

    private Mono<Void> upsertTask(ReviewTask task) {
        MetricKey key = task.key();
        return Mono.fromCallable(() -> toJson(task))
            .flatMap(payload -> taskRepository.upsertTask(
                task.taskId(), key.metricName(), key.entityId(), key.period(),
                task.priority().name(), task.status().name(),
                task.decision() != null ? task.decision().name() : null,
                task.correctedValue(), payload,
                toLocal(task.createdAt()), toLocal(task.decidedAt())))
            .doOnSuccess(v -> log.debug("Review task persisted. taskId={} status={}", task.taskId(), task.status()));
    }

    private Mono<Void> decidePending(ReviewTask task) {
        return Mono.fromCallable(() -> toJson(task))
            .flatMap(payload -> taskRepository.decidePending(task.taskId(), task.status().name(),
                task.decision().name(), task.correctedValue(), payload, toLocal(task.decidedAt())))
            .flatMap(rows -> rows == 1 ? Mono.<Void>empty() : closedTask(task.taskId()));
    }

    private Mono<Void> closedTask(String taskId) {
        return reviewTaskStatus(taskId)
            .switchIfEmpty(Mono.error(() -> new ReviewTaskNotFoundException(taskId)))
            .flatMap(status -> Mono.<Void>error(new ReviewAlreadyDecidedException(taskId, status)));
    }

    /** Stored status of a task; empty when it was never stored. */
    public Mono<ReviewStatus> reviewTaskStatus(String taskId) {
        return taskRepository.findById(taskId)
            .map(record -> ReviewStatus.valueOf(record.getStatus()));
    }

    public Flux<ReviewTask> pendingReviewTasks() {
        return taskRepository.findByStatus(ReviewStatus.PENDING.name())
            .map(record -> fromJson(record.getPayload(), ReviewTask.class));
    }

    // ── source trust ─────────────────────────────────────────────────────────

    public Mono<Void> saveSourceTrust(Source source) {
        return trustRepository.upsertAccuracy(source.sourceId(), source.category().name(),
                                              source.baseWeight(), source.historicalAccuracy());
    }

    public Flux<SourceTrustRecord> persistedTrust() {
        return trustRepository.findAll();
    }

    /**
     * Appends each adjustment to the accuracy log and writes the source's resulting accuracy.
     */
    private Mono<Void> saveAdjustments(List<AccuracyAdjustment> adjustments) {
        return Flux.fromIterable(adjustments)
            .concatMap(a -> accuracyLogRepository.save(toEntity(a))
                .then(saveSourceTrust(registry.getSource(a.sourceId()))))
            .then();
    }

    public Flux<AccuracyAdjustment> accuracyLog(String sourceId) {
        return accuracyLogRepository.findBySourceIdOrderByIdAsc(sourceId)
            .map(r -> new AccuracyAdjustment(r.getSourceId(), r.getPreviousAccuracy(), r.getNewAccuracy(),
                r.getRequestedDelta(), r.getReason(),
                r.getAdjustedAt() != null ? r.getAdjustedAt().toInstant(ZoneOffset.UTC) : null));
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    private ResolvedMetricRecord toEntity(ResolvedMetric metric) {
        ResolvedMetricRecord entity = new ResolvedMetricRecord();
        entity.setMetricName(metric.metricName());
        entity.setEntityId(metric.entityId());
        entity.setPeriod(metric.period());
        entity.setFinalValue(metric.finalValue());
        entity.setConfidence(metric.confidence());
        entity.setResolutionMethod(metric.resolutionMethod().name());
        entity.setQualityScore(metric.qualityScore());
        entity.setQualityGrade(metric.qualityGrade().label());
        entity.setPayload(toJson(metric));
        entity.setResolvedAt(LocalDateTime.now(clock));
        return entity;
    }

    private static SourceAccuracyLogRecord toEntity(AccuracyAdjustment adjustment) {
        SourceAccuracyLogRecord entity = new SourceAccuracyLogRecord();
        entity.setSourceId(adjustment.sourceId());
        entity.setPreviousAccuracy(adjustment.previousAccuracy());
        entity.setNewAccuracy(adjustment.newAccuracy());
        entity.setRequestedDelta(adjustment.requestedDelta());
        entity.setReason(adjustment.reason());
        entity.setAdjustedAt(toLocal(adjustment.adjustedAt()));
        return entity;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new ReconciliationException(FailureKind.PERSISTENCE, value.getClass().getSimpleName(), "failed to serialise payload", e);
        }
    }

    private <T> T fromJson(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (Exception e) {
            throw new ReconciliationException(FailureKind.PERSISTENCE, type.getSimpleName(), "failed to read stored payload", e);
        }
    }

    private static LocalDateTime toLocal(Instant instant) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }
}
