package com.metricrecon.reconciliation.service;

import com.metricrecon.common.engine.BenchmarkProvider;
import com.metricrecon.common.engine.ReconciliationEngine;
import com.metricrecon.common.engine.Resolution;
import com.metricrecon.common.engine.ReviewOutcome;
import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.exception.ReviewTaskNotFoundException;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.ResolutionContext;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewStatus;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.common.model.Source;
import com.metricrecon.reconciliation.config.ReconciliationProperties;
import com.metricrecon.reconciliation.dto.BatchItemResultDTO;
import com.metricrecon.reconciliation.dto.BatchResolveRequest;
import com.metricrecon.reconciliation.dto.ResolutionDTO;
import com.metricrecon.reconciliation.dto.ResolveRequest;
import com.metricrecon.reconciliation.dto.ReviewDecisionRequest;
import com.metricrecon.reconciliation.dto.SourceTrustDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Reactive facade over {@link ReconciliationEngine}: loads trailing history from the store,
 * runs the synchronous engine and persists what it produced.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final ReconciliationEngine engine;
    private final ReconciliationStore store;
    private final BenchmarkProvider benchmarkProvider;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public ReconciliationService(ReconciliationEngine engine,
                                 ReconciliationStore store,
                                 BenchmarkProvider benchmarkProvider,
                                 ReconciliationProperties properties,
                                 Clock clock) {
        this.engine            = engine;
        this.store             = store;
        this.benchmarkProvider = benchmarkProvider;
        this.properties        = properties;
        this.clock             = clock;
    }

    // ── resolution ───────────────────────────────────────────────────────────

    public Mono<ResolutionDTO> resolve(ResolveRequest request) {
        return Mono.fromCallable(request::key)
            .flatMap(key -> store.trailingHistory(key, properties.getTrailingHistorySize())
                .map(history -> engine.evaluate(key, request.toObservations(), contextFor(key, history))))
            .flatMap(this::persistAndCommit)
            .doOnError(e -> log.warn("Resolution failed. entityId={} metric={} period={} error={}",
                                     request.entityId(), request.metricName(), request.period(), e.getMessage()));
    }

    /**
     * Resolves independent units with at most {@code batch-concurrency} in flight. Results keep
     * the request order; a failing unit yields an error entry and does not stop the others.
     */
    public Flux<BatchItemResultDTO> resolveBatch(BatchResolveRequest request) {
        List<ResolveRequest> units = request.units() != null ? request.units() : List.of();
        int concurrency = Math.max(1, properties.getBatchConcurrency());
        log.info("Batch resolution started. units={} concurrency={}", units.size(), concurrency);
        return Flux.fromIterable(units)
            .flatMapSequential(unit -> resolve(unit)
                .subscribeOn(Schedulers.parallel())
                .map(resolution -> BatchItemResultDTO.resolved(unit, resolution))
                .onErrorResume(e -> Mono.just(BatchItemResultDTO.failed(unit, e.getMessage()))),
                concurrency);
    }

    private ResolutionContext contextFor(MetricKey key, List<Double> history) {
        return new ResolutionContext(history,
            benchmarkProvider.benchmarkFor(key.entityId(), key.metricName()).orElse(null),
            Instant.now(clock));
    }

    /**
     * The review queue only sees a resolution once it is stored, so a failed write leaves no
     * task behind.
     */
    private Mono<ResolutionDTO> persistAndCommit(Resolution resolution) {
        ReviewTask task = resolution.reviewTask();
        return store.persistResolution(resolution.metric(), task)
            .map(saved -> {
                engine.commit(resolution);
                return new ResolutionDTO(saved.getId(), resolution.metric(), task);
            });
    }

    // ── review ───────────────────────────────────────────────────────────────

    public Flux<ReviewTask> pendingReviews(ReviewPriority priority) {
        return Flux.defer(() -> Flux.fromIterable(engine.getPendingReviews(priority)));
    }

    /**
     * Records the decision in the engine, then persists the decided task, the accuracy changes
     * and, for a correction, the replacement metric. A failed write rolls the engine back. A task
     * this instance no longer knows is checked against its stored status.
     */
    public Mono<ReviewOutcome> submitDecision(String taskId, ReviewDecisionRequest request) {
        return Mono.fromCallable(() -> {
                if (request.decision() == null) {
                    throw new IllegalArgumentException("decision is required");
                }
                return engine.reviewDecision(taskId, request.decision(), request.notes(), request.correctedValue());
            })
            .onErrorResume(ReviewTaskNotFoundException.class, e -> storedClosure(taskId, e))
            .flatMap(outcome -> store.persistDecision(outcome)
                .onErrorResume(e -> {
                    engine.rollbackDecision(outcome, e);
                    return Mono.error(e);
                })
                .thenReturn(outcome))
            .doOnSuccess(outcome -> log.info("Review decision applied. taskId={} decision={} corrected={} adjustments={}",
                taskId, request.decision(), outcome.corrected(), outcome.adjustments().size()))
            .doOnError(e -> log.warn("Review decision failed. taskId={} error={}", taskId, e.getMessage()));
    }

    private Mono<ReviewOutcome> storedClosure(String taskId, ReviewTaskNotFoundException notFound) {
        return store.reviewTaskStatus(taskId)
            .filter(status -> status != ReviewStatus.PENDING)
            .flatMap(status -> Mono.<ReviewOutcome>error(new ReviewAlreadyDecidedException(taskId, status)))
            .switchIfEmpty(Mono.error(notFound));
    }

    // ── introspection ────────────────────────────────────────────────────────

    public Mono<SourceTrustDTO> sourceTrust(String sourceId) {
        return Mono.fromCallable(() -> {
            Source source = engine.getSourceTrust(sourceId);
            return SourceTrustDTO.of(source, engine.registry().categoryWeight(source.category()));
        });
    }

    /**
     * Persisted accuracy log of a registered source, oldest first.
     */
    public Flux<AccuracyAdjustment> accuracyAdjustments(String sourceId) {
        return Mono.fromCallable(() -> engine.getSourceTrust(sourceId))
            .thenMany(Flux.defer(() -> store.accuracyLog(sourceId)));
    }

    public Mono<ResolvedMetric> currentMetric(String entityId, String metricName, String period) {
        return Mono.fromCallable(() -> new MetricKey(metricName, entityId, period))
            .flatMap(store::currentMetric);
    }
}
