package com.metricrecon.common.engine;

import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.Observation;
import com.metricrecon.common.model.ResolutionContext;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewDecision;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.resolution.ConflictResolver;
import com.metricrecon.common.review.DecisionOutcome;
import com.metricrecon.common.review.ReviewQueueManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Programmatic boundary of the engine: resolve, list pending reviews, submit a review decision,
 * inspect source trust.
 *
 * <p>Resolution itself is synchronous and performs no I/O; history and benchmarks come either from
 * the configured providers or from an explicit {@link ResolutionContext} assembled by the caller.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ConflictResolver resolver;
    private final ReviewQueueManager reviewQueue;
    private final SourceRegistry registry;
    private final MetricHistoryProvider historyProvider;
    private final BenchmarkProvider benchmarkProvider;
    private final Clock clock;

    public ReconciliationEngine(ConflictResolver resolver,
                                ReviewQueueManager reviewQueue,
                                SourceRegistry registry,
                                MetricHistoryProvider historyProvider,
                                BenchmarkProvider benchmarkProvider,
                                Clock clock) {
        this.resolver          = resolver;
        this.reviewQueue       = reviewQueue;
        this.registry          = registry;
        this.historyProvider   = historyProvider;
        this.benchmarkProvider = benchmarkProvider;
        this.clock             = clock;
    }

    public Resolution resolve(String metricName, String entityId, String period, List<Observation> observations) {
        MetricKey key = new MetricKey(metricName, entityId, period);
        ResolutionContext context = new ResolutionContext(
            historyProvider.trailingValues(entityId, metricName, period),
            benchmarkProvider.benchmarkFor(entityId, metricName).orElse(null),
            Instant.now(clock));
        return resolve(key, observations, context);
    }

    public Resolution resolve(MetricKey key, List<Observation> observations, ResolutionContext context) {
        Resolution resolution = evaluate(key, observations, context);
        commit(resolution);
        return resolution;
    }

    /**
     * Resolves and builds the review task, if one is needed, without touching the queue. A caller
     * that stores results runs {@link #commit} only once the resolution is stored, so nothing of a
     * failed unit becomes visible.
     */
    public Resolution evaluate(MetricKey key, List<Observation> observations, ResolutionContext context) {
        ResolvedMetric metric = resolver.resolve(key, observations, context);
        Optional<ReviewTask> task = reviewQueue.prepare(metric);
        log.info("METRIC_RESOLVED key={} method={} value={} confidence={} grade={} review={}",
                 key, metric.resolutionMethod(), metric.finalValue(), metric.confidence(),
                 metric.qualityGrade().label(), task.map(ReviewTask::priority).orElse(null));
        return new Resolution(metric, task.orElse(null));
    }

    /**
     * Queues the resolution's review task, retiring any task still pending for the same key.
     *
     * @return the retired task
     */
    public Optional<ReviewTask> commit(Resolution resolution) {
        return reviewQueue.commit(resolution.metric().key(), resolution.reviewTask());
    }

    public List<ReviewTask> getPendingReviews(ReviewPriority priority) {
        return reviewQueue.pendingTasks(priority);
    }

    public List<ReviewTask> getPendingReviews() {
        return getPendingReviews(null);
    }

    /**
     * @return the reviewed metric, or a reviewer-corrected replacement when {@code correctedValue}
     *         is given
     */
    public ResolvedMetric submitReviewDecision(String taskId, ReviewDecision decision,
                                               String notes, Double correctedValue) {
        return reviewDecision(taskId, decision, notes, correctedValue).metric();
    }

    public ReviewOutcome reviewDecision(String taskId, ReviewDecision decision,
                                        String notes, Double correctedValue) {
        if (correctedValue != null && !Double.isFinite(correctedValue)) {
            throw new IllegalArgumentException("corrected value must be finite: " + correctedValue);
        }
        DecisionOutcome outcome = reviewQueue.recordDecision(taskId, decision, notes, correctedValue);
        ResolvedMetric reviewed = outcome.task().metric();
        if (correctedValue == null) {
            return new ReviewOutcome(outcome.task(), reviewed, false, outcome.adjustments());
        }
        return new ReviewOutcome(outcome.task(), reviewed.withReviewerCorrection(correctedValue, notes),
                                 true, outcome.adjustments());
    }

    /**
     * Reverses a decision whose effects could not be stored: trust changes are undone and the task
     * is pending again. When the store reports that the task was closed elsewhere it stays closed.
     */
    public void rollbackDecision(ReviewOutcome outcome, Throwable cause) {
        DecisionOutcome decision = new DecisionOutcome(outcome.task(), outcome.adjustments());
        if (cause instanceof ReviewAlreadyDecidedException) {
            reviewQueue.revoke(decision, ((ReviewAlreadyDecidedException) cause).getStatus());
        } else {
            reviewQueue.reopen(decision);
        }
    }

    public Source getSourceTrust(String sourceId) {
        return registry.getSource(sourceId);
    }

    public SourceRegistry registry() {
        return registry;
    }

    public ReviewQueueManager reviewQueue() {
        return reviewQueue;
    }
}
