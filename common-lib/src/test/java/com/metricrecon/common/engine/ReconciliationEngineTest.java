package com.metricrecon.common.engine;

import com.metricrecon.common.Fixtures;
import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.exception.UnknownSourceException;
import com.metricrecon.common.model.AnomalySeverity;
import com.metricrecon.common.model.AuditCode;
import com.metricrecon.common.model.AuditEvent;
import com.metricrecon.common.model.BenchmarkRange;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.ResolutionContext;
import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewDecision;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewStatus;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.review.ReviewQueueManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.metricrecon.common.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReconciliationEngineTest {

    private SourceRegistry registry;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        registry = Fixtures.registry(0.9);
        ReviewQueueManager queue = new ReviewQueueManager(registry, 0.4, 0.02, CLOCK);
        MetricHistoryProvider history = (entityId, metricName, period) ->
            ENTITY.equals(entityId) ? List.of(1000.0, 1002.0, 998.0, 1001.0, 999.0) : List.of();
        BenchmarkProvider benchmarks = (entityId, metricName) -> Optional.empty();
        engine = new ReconciliationEngine(Fixtures.resolver(registry), queue, registry, history, benchmarks, CLOCK);
    }

    @Test
    @DisplayName("history from the provider drives anomaly detection and review")
    void resolveWithProvidedHistory() {
        Resolution resolution = engine.resolve(REVENUE, ENTITY, PERIOD,
            List.of(obs(AGG_A, 1015.0), obs(AGG_B, 1015.0)));

        assertEquals(AnomalySeverity.HIGH, resolution.metric().maxSeverity());
        ReviewTask task = resolution.review().orElseThrow();
        assertEquals(ReviewPriority.URGENT, task.priority());
        assertEquals(List.of(task), engine.getPendingReviews());
    }

    @Test
    @DisplayName("confident resolution raises no review")
    void noReview() {
        Resolution resolution = engine.resolve(REVENUE, ENTITY, PERIOD,
            List.of(obs(AGG_A, 1000.0), obs(AGG_B, 1001.0)));
        assertTrue(resolution.review().isEmpty());
        assertTrue(engine.getPendingReviews().isEmpty());
    }

    @Test
    @DisplayName("benchmark provider feeds the peer check")
    void benchmarkUsed() {
        ReconciliationEngine withBenchmark = new ReconciliationEngine(Fixtures.resolver(registry),
            engine.reviewQueue(), registry, MetricHistoryProvider.none(),
            (entityId, metricName) -> Optional.of(new BenchmarkRange(10.0, 20.0)), CLOCK);
        ResolvedMetric m = withBenchmark.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(AGG_A, 100.0))).metric();
        assertEquals(AnomalySeverity.MEDIUM, m.maxSeverity());
    }

    @Test
    @DisplayName("decision with a corrected value returns a reviewer-corrected record and moves trust")
    void correctedDecision() {
        ReviewTask task = engine.resolve(REVENUE, ENTITY, PERIOD,
            List.of(obs(AGG_A, 1015.0), obs(AGG_B, 1015.0))).review().orElseThrow();

        ResolvedMetric corrected = engine.submitReviewDecision(task.taskId(), ReviewDecision.REJECT,
            "restated in 10-Q", 1001.0);

        assertEquals(ResolutionMethod.REVIEWER_CORRECTION, corrected.resolutionMethod());
        assertEquals(1001.0, corrected.finalValue());
        assertEquals(ResolvedMetric.REVIEWER_CORRECTION_CONFIDENCE, corrected.confidence());
        assertEquals(AuditCode.REVIEWER_CORRECTION,
            corrected.auditTrail().get(corrected.auditTrail().size() - 1).code());
        assertEquals(0.88, engine.getSourceTrust(AGG_A).historicalAccuracy(), 1e-12);
        assertTrue(engine.getPendingReviews().isEmpty());
    }

    @Test
    @DisplayName("decision without a correction returns the reviewed record unchanged")
    void plainApproval() {
        Resolution resolution = engine.resolve(REVENUE, ENTITY, PERIOD,
            List.of(obs(AGG_A, 1015.0), obs(AGG_B, 1015.0)));
        ReviewOutcome outcome = engine.reviewDecision(resolution.reviewTask().taskId(),
            ReviewDecision.APPROVE, null, null);
        assertFalse(outcome.corrected());
        assertEquals(resolution.metric(), outcome.metric());
        assertEquals(2, outcome.adjustments().size());
    }

    @Test
    @DisplayName("non-finite correction is refused before the task is touched")
    void nonFiniteCorrection() {
        ReviewTask task = engine.resolve(REVENUE, ENTITY, PERIOD,
            List.of(obs(AGG_A, 1015.0), obs(AGG_B, 1015.0))).review().orElseThrow();
        assertThrows(IllegalArgumentException.class,
            () -> engine.submitReviewDecision(task.taskId(), ReviewDecision.REJECT, null, Double.NaN));
        assertEquals(1, engine.getPendingReviews().size());
    }

    @Test
    @DisplayName("source trust lookup fails for unknown ids")
    void sourceTrust() {
        assertEquals(0.9, engine.getSourceTrust(SEC).historicalAccuracy(), 1e-12);
        assertThrows(UnknownSourceException.class, () -> engine.getSourceTrust("ghost"));
    }

    @Test
    @DisplayName("audit trail records every skipped check")
    void auditForSkippedChecks() {
        ResolvedMetric m = engine.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(SEC, 10.0))).metric();
        List<AuditCode> codes = m.auditTrail().stream().map(AuditEvent::code).toList();
        assertTrue(codes.containsAll(List.of(
            AuditCode.RANGE_CHECK_SKIPPED, AuditCode.ANOMALY_DETECTION_DEGRADED, AuditCode.PEER_CHECK_SKIPPED)));
    }

    // ── review lifecycle across re-resolution ─────────────────────────────

    @Nested
    @DisplayName("re-resolving a key with a pending review")
    class ReResolutionTests {

        private SourceRegistry trusted;
        private ReconciliationEngine fresh;

        @BeforeEach
        void setUp() {
            trusted = Fixtures.registry();
            fresh = new ReconciliationEngine(Fixtures.resolver(trusted),
                new ReviewQueueManager(trusted, 0.4, 0.02, CLOCK), trusted,
                MetricHistoryProvider.none(), BenchmarkProvider.none(), CLOCK);
        }

        @Test
        @DisplayName("two low-confidence runs leave one task; rejecting both nudges trust once")
        void oneNudgePerKey() {
            ReviewTask first  = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(ANALYST, 50.0))).review().orElseThrow();
            ReviewTask second = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(ANALYST, 50.0))).review().orElseThrow();

            assertEquals(List.of(second), fresh.getPendingReviews());

            fresh.submitReviewDecision(second.taskId(), ReviewDecision.REJECT, null, null);
            assertThrows(ReviewAlreadyDecidedException.class,
                () -> fresh.submitReviewDecision(first.taskId(), ReviewDecision.REJECT, null, null));

            assertEquals(0.98, fresh.getSourceTrust(ANALYST).historicalAccuracy(), 1e-12);
        }

        @Test
        @DisplayName("a confident re-run closes the stale task")
        void confidentRerun() {
            ReviewTask stale = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(ANALYST, 50.0))).review().orElseThrow();

            Resolution rerun = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(SEC, 50.0)));

            assertTrue(rerun.review().isEmpty());
            assertTrue(fresh.getPendingReviews().isEmpty());
            assertThrows(ReviewAlreadyDecidedException.class,
                () -> fresh.submitReviewDecision(stale.taskId(), ReviewDecision.APPROVE, null, null));
            assertEquals(1.0, fresh.getSourceTrust(ANALYST).historicalAccuracy(), 1e-12);
        }

        @Test
        @DisplayName("evaluate queues nothing until commit")
        void evaluateThenCommit() {
            Resolution resolution = fresh.evaluate(new MetricKey(REVENUE, "MSFT", PERIOD), List.of(obs(ANALYST, 50.0)),
                ResolutionContext.withoutHistory(NOW));

            assertTrue(resolution.review().isPresent());
            assertTrue(fresh.getPendingReviews().isEmpty());

            fresh.commit(resolution);
            assertEquals(List.of(resolution.reviewTask()), fresh.getPendingReviews());
        }

        @Test
        @DisplayName("rollback after a failed write restores trust and the pending task")
        void rollback() {
            ReviewTask task = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(ANALYST, 50.0))).review().orElseThrow();
            ReviewOutcome outcome = fresh.reviewDecision(task.taskId(), ReviewDecision.REJECT, null, null);
            assertEquals(0.98, fresh.getSourceTrust(ANALYST).historicalAccuracy(), 1e-12);

            fresh.rollbackDecision(outcome, new IllegalStateException("write failed"));

            assertEquals(1.0, fresh.getSourceTrust(ANALYST).historicalAccuracy(), 1e-12);
            assertEquals(List.of(task), fresh.getPendingReviews());
        }

        @Test
        @DisplayName("rollback after losing to a stored decision keeps the task closed")
        void rollbackClosedElsewhere() {
            ReviewTask task = fresh.resolve(REVENUE, "MSFT", PERIOD, List.of(obs(ANALYST, 50.0))).review().orElseThrow();
            ReviewOutcome outcome = fresh.reviewDecision(task.taskId(), ReviewDecision.REJECT, null, null);

            fresh.rollbackDecision(outcome, new ReviewAlreadyDecidedException(task.taskId(), ReviewStatus.APPROVED));

            assertEquals(1.0, fresh.getSourceTrust(ANALYST).historicalAccuracy(), 1e-12);
            assertTrue(fresh.getPendingReviews().isEmpty());
            assertEquals(ReviewStatus.APPROVED, fresh.reviewQueue().closedStatus(task.taskId()).orElseThrow());
        }
    }
}
