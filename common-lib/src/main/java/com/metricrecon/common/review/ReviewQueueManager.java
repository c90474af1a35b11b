package com.metricrecon.common.review;

import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.exception.ReviewTaskNotFoundException;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewDecision;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewStatus;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.common.registry.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Queue of resolutions a human has to look at, and the feedback path from their decisions
 * into source trust.
 *
 * <h3>Enqueue rule</h3>
 * A task is raised iff {@code confidence < reviewThreshold} or the highest anomaly severity is HIGH.
 * <pre>
 *   HIGH anomaly                                      → URGENT
 *   below threshold with a MEDIUM finding, or below
 *   half the threshold                                → NORMAL
 *   otherwise                                         → LOW
 * </pre>
 *
 * <h3>One pending task per metric key</h3>
 * A newer resolution of the same metric/entity/period retires the pending task of the older one
 * ({@link ReviewStatus#SUPERSEDED}); a newer resolution that needs no review just retires it.
 * Decided and retired tasks leave the live queue at once. Only their ids and final status are
 * remembered, for the last {@value #CLOSED_TASK_MEMORY} of them, so a late duplicate decision is
 * still answered with {@link ReviewAlreadyDecidedException}; older ones are the caller's store's
 * concern.
 *
 * <h3>Feedback</h3>
 * APPROVE moves every non-discarded contributing source's historical accuracy up by
 * {@code accuracyStep}, REJECT moves it down; the registry clamps to [0.0, 1.0].
 *
 * <p>Thread-safe: every change of a key's pending task runs inside one
 * {@link ConcurrentHashMap#compute} on that key, so concurrent decisions on one task resolve to
 * exactly one winner and every loser sees {@link ReviewAlreadyDecidedException}.
 */
public class ReviewQueueManager {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueManager.class);

    public static final double DEFAULT_REVIEW_THRESHOLD = 0.4;
    public static final double DEFAULT_ACCURACY_STEP    = 0.02;

    static final int CLOSED_TASK_MEMORY = 1024;

    private static final Comparator<ReviewTask> QUEUE_ORDER =
        Comparator.comparing(ReviewTask::priority)
            .thenComparing(ReviewTask::createdAt)
            .thenComparing(ReviewTask::taskId);

    private final SourceRegistry registry;
    private final double reviewThreshold;
    private final double accuracyStep;
    private final Clock clock;
    private final Supplier<String> taskIds;

    private final ConcurrentHashMap<MetricKey, ReviewTask> pendingByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, MetricKey> keyByTaskId = new ConcurrentHashMap<>();
    private final Map<String, ReviewStatus> recentlyClosed = Collections.synchronizedMap(
        new LinkedHashMap<String, ReviewStatus>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ReviewStatus> eldest) {
                return size() > CLOSED_TASK_MEMORY;
            }
        });

    public ReviewQueueManager(SourceRegistry registry, double reviewThreshold, double accuracyStep,
                              Clock clock, Supplier<String> taskIds) {
        if (!(reviewThreshold >= 0.0 && reviewThreshold <= 1.0)) {
            throw new IllegalArgumentException("review threshold must be in [0,1]: " + reviewThreshold);
        }
        if (!(accuracyStep > 0.0 && accuracyStep <= 1.0)) {
            throw new IllegalArgumentException("accuracy step must be in (0,1]: " + accuracyStep);
        }
        this.registry        = registry;
        this.reviewThreshold = reviewThreshold;
        this.accuracyStep    = accuracyStep;
        this.clock           = clock;
        this.taskIds         = taskIds;
    }

    public ReviewQueueManager(SourceRegistry registry, double reviewThreshold, double accuracyStep, Clock clock) {
        this(registry, reviewThreshold, accuracyStep, clock, () -> UUID.randomUUID().toString());
    }

    public double reviewThreshold() {
        return reviewThreshold;
    }

    public boolean requiresReview(ResolvedMetric metric) {
        return metric.confidence() < reviewThreshold
            || metric.maxSeverity() == AnomalySeverity.HIGH;
    }

    /**
     * Builds the pending task {@code metric} needs without queueing it, so the caller can store it
     * first and {@link #commit} afterwards.
     */
    public Optional<ReviewTask> prepare(ResolvedMetric metric) {
        if (!requiresReview(metric)) {
            return Optional.empty();
        }
        return Optional.of(ReviewTask.pending(taskIds.get(), metric, priorityFor(metric), Instant.now(clock)));
    }

    /**
     * Makes {@code task} the pending review of {@code key}, or leaves the key without one when
     * {@code task} is {@code null}. A different task pending for the key is retired.
     *
     * @return the retired task, already marked {@link ReviewStatus#SUPERSEDED}
     */
    public Optional<ReviewTask> commit(MetricKey key, ReviewTask task) {
        if (task != null && !key.equals(task.key())) {
            throw new IllegalArgumentException("task " + task.taskId() + " belongs to " + task.key() + ", not " + key);
        }
        Instant now = Instant.now(clock);
        AtomicReference<ReviewTask> retired = new AtomicReference<>();
        pendingByKey.compute(key, (k, current) -> {
            if (current != null && (task == null || !current.taskId().equals(task.taskId()))) {
                retired.set(current.superseded(now));
                close(current.taskId(), ReviewStatus.SUPERSEDED);
            }
            if (task != null) {
                keyByTaskId.put(task.taskId(), k);
            }
            return task;
        });

        if (task != null) {
            log.info("REVIEW_ENQUEUED taskId={} key={} priority={} confidence={} severity={}",
                     task.taskId(), key, task.priority(), task.metric().confidence(), task.metric().maxSeverity());
        }
        if (retired.get() != null) {
            log.info("REVIEW_SUPERSEDED taskId={} key={} replacedBy={}",
                     retired.get().taskId(), key, task != null ? task.taskId() : null);
        }
        return Optional.ofNullable(retired.get());
    }

    /** {@link #prepare} and {@link #commit} in one step. */
    public Optional<ReviewTask> maybeEnqueue(ResolvedMetric metric) {
        Optional<ReviewTask> task = prepare(metric);
        commit(metric.key(), task.orElse(null));
        return task;
    }

    ReviewPriority priorityFor(ResolvedMetric metric) {
        AnomalySeverity severity = metric.maxSeverity();
        if (severity == AnomalySeverity.HIGH) {
            return ReviewPriority.URGENT;
        }
        if (severity == AnomalySeverity.MEDIUM || metric.confidence() < reviewThreshold / 2.0) {
            return ReviewPriority.NORMAL;
        }
        return ReviewPriority.LOW;
    }

    /**
     * Pending tasks, most urgent first, oldest first within a priority.
     *
     * @param priority optional filter; {@code null} returns every pending task
     */
    public List<ReviewTask> pendingTasks(ReviewPriority priority) {
        return pendingByKey.values().stream()
            .filter(t -> priority == null || t.priority() == priority)
            .sorted(QUEUE_ORDER)
            .toList();
    }

    /** A task that is still pending. */
    public Optional<ReviewTask> find(String taskId) {
        MetricKey key = taskId == null ? null : keyByTaskId.get(taskId);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pendingByKey.get(key)).filter(t -> t.taskId().equals(taskId));
    }

    /** Final status of a recently decided or retired task. */
    public Optional<ReviewStatus> closedStatus(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(recentlyClosed.get(taskId));
    }

    /**
     * Records a reviewer's verdict, feeds it back into source accuracy and takes the task out of
     * the queue.
     *
     * @param correctedValue value supplied by the reviewer, or {@code null}
     * @throws ReviewTaskNotFoundException   no such task is pending or recently closed
     * @throws ReviewAlreadyDecidedException the task was decided or retired before
     */
    public DecisionOutcome recordDecision(String taskId, ReviewDecision decision,
                                          String notes, Double correctedValue) {
        MetricKey key = taskId == null ? null : keyByTaskId.get(taskId);
        AtomicReference<ReviewTask> decided = new AtomicReference<>();
        if (key != null) {
            Instant now = Instant.now(clock);
            pendingByKey.computeIfPresent(key, (k, current) -> {
                if (!current.taskId().equals(taskId)) {
                    return current;
                }
                decided.set(current.decided(decision, notes, correctedValue, now));
                close(taskId, decided.get().status());
                return null;
            });
        }
        if (decided.get() == null) {
            Optional<ReviewStatus> closed = closedStatus(taskId);
            if (closed.isPresent()) {
                throw new ReviewAlreadyDecidedException(taskId, closed.get());
            }
            throw new ReviewTaskNotFoundException(taskId);
        }

        double delta = decision == ReviewDecision.APPROVE ? accuracyStep : -accuracyStep;
        List<AccuracyAdjustment> adjustments = new ArrayList<>();
        for (String sourceId : activeSourceIds(decided.get().metric())) {
            if (!registry.isRegistered(sourceId)) {
                log.warn("Accuracy feedback skipped: source no longer registered. taskId={} sourceId={}",
                         taskId, sourceId);
                continue;
            }
            adjustments.add(registry.updateAccuracy(sourceId, delta, "review " + decision + " task=" + taskId));
        }

        log.info("REVIEW_DECIDED taskId={} key={} decision={} corrected={} sourcesAdjusted={}",
                 taskId, decided.get().key(), decision, correctedValue != null, adjustments.size());
        return new DecisionOutcome(decided.get(), adjustments);
    }

    /**
     * Undoes a decision whose effects could not be stored: the accuracy changes are reversed and
     * the task is pending again, unless a newer task for its key was queued in the meantime.
     */
    public void reopen(DecisionOutcome outcome) {
        ReviewTask task = outcome.task().reopened();
        reverseAdjustments(outcome);
        AtomicBoolean requeued = new AtomicBoolean();
        pendingByKey.compute(task.key(), (k, current) -> {
            if (current != null) {
                close(task.taskId(), ReviewStatus.SUPERSEDED);
                return current;
            }
            recentlyClosed.remove(task.taskId());
            keyByTaskId.put(task.taskId(), k);
            requeued.set(true);
            return task;
        });
        log.warn("REVIEW_REOPENED taskId={} key={} requeued={} adjustmentsReversed={}",
                 task.taskId(), task.key(), requeued.get(), outcome.adjustments().size());
    }

    /**
     * Undoes the accuracy changes of a decision that lost to one already stored elsewhere. The task
     * stays closed with the stored status.
     */
    public void revoke(DecisionOutcome outcome, ReviewStatus storedStatus) {
        reverseAdjustments(outcome);
        close(outcome.task().taskId(), storedStatus);
        log.warn("REVIEW_REVOKED taskId={} storedStatus={} adjustmentsReversed={}",
                 outcome.task().taskId(), storedStatus, outcome.adjustments().size());
    }

    private void reverseAdjustments(DecisionOutcome outcome) {
        for (AccuracyAdjustment a : outcome.adjustments()) {
            registry.updateAccuracy(a.sourceId(), a.previousAccuracy() - a.newAccuracy(),
                                    "rollback task=" + outcome.task().taskId());
        }
    }

    /**
     * Reloads a persisted pending task at startup. When several share a key the newest one stays.
     *
     * @return {@code true} when the task is pending in the queue afterwards
     */
    public boolean restore(ReviewTask task) {
        if (!task.isPending()) {
            return false;
        }
        AtomicBoolean queued = new AtomicBoolean();
        pendingByKey.compute(task.key(), (k, current) -> {
            if (current != null && !current.createdAt().isBefore(task.createdAt())) {
                close(task.taskId(), ReviewStatus.SUPERSEDED);
                return current;
            }
            if (current != null) {
                close(current.taskId(), ReviewStatus.SUPERSEDED);
            }
            keyByTaskId.put(task.taskId(), k);
            queued.set(true);
            return task;
        });
        return queued.get();
    }

    public int pendingCount() {
        return pendingByKey.size();
    }

    private void close(String taskId, ReviewStatus status) {
        recentlyClosed.put(taskId, status);
        keyByTaskId.remove(taskId);
    }

    private static TreeSet<String> activeSourceIds(ResolvedMetric metric) {
        TreeSet<String> ids = new TreeSet<>();
        for (ContributingSource c : metric.activeSources()) {
            ids.add(c.sourceId());
        }
        return ids;
    }
}
