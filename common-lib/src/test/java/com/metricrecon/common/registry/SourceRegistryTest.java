package com.metricrecon.common.registry;

import com.metricrecon.common.Fixtures;
import com.metricrecon.common.exception.ReconciliationConfigException;
import com.metricrecon.common.exception.UnknownSourceException;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.model.SourceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    // ── loading ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("builder validation")
    class BuilderTests {

        @Test
        @DisplayName("base weight above 1 is rejected")
        void baseWeightOutOfRange() {
            assertThrows(ReconciliationConfigException.class, () ->
                SourceRegistry.builder().register("x", SourceCategory.PREDICTIVE, 1.2, 1.0));
        }

        @Test
        @DisplayName("negative accuracy is rejected")
        void accuracyOutOfRange() {
            assertThrows(ReconciliationConfigException.class, () ->
                SourceRegistry.builder().register("x", SourceCategory.PREDICTIVE, 0.5, -0.1));
        }

        @Test
        @DisplayName("duplicate source id is rejected")
        void duplicateId() {
            SourceRegistry.Builder builder = SourceRegistry.builder()
                .register("x", SourceCategory.PREDICTIVE, 0.5, 1.0);
            assertThrows(ReconciliationConfigException.class, () ->
                builder.register("x", SourceCategory.REGULATORY, 1.0, 1.0));
        }

        @Test
        @DisplayName("missing category is rejected")
        void missingCategory() {
            assertThrows(ReconciliationConfigException.class, () ->
                SourceRegistry.builder().register("x", null, 0.5, 1.0));
        }

        @Test
        @DisplayName("category weights default and can be overridden")
        void categoryWeights() {
            SourceRegistry defaults = SourceRegistry.builder().build();
            assertEquals(1.0, defaults.categoryWeight(SourceCategory.REGULATORY));
            assertEquals(0.6, defaults.categoryWeight(SourceCategory.PREDICTIVE));

            SourceRegistry custom = SourceRegistry.builder()
                .categoryWeight(SourceCategory.PREDICTIVE, 0.4)
                .build();
            assertEquals(0.4, custom.categoryWeight(SourceCategory.PREDICTIVE));
            assertEquals(0.9, custom.categoryWeight(SourceCategory.MULTI_SOURCE_AGGREGATE));
        }
    }

    // ── lookups ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("getSource()")
    class LookupTests {

        @Test
        @DisplayName("registered source → snapshot with effective weight")
        void knownSource() {
            Source source = Fixtures.registry(0.5).getSource(Fixtures.AGG_A);
            assertEquals(SourceCategory.MULTI_SOURCE_AGGREGATE, source.category());
            assertEquals(0.8, source.baseWeight());
            assertEquals(0.4, source.effectiveWeight(), 1e-12);
        }

        @Test
        @DisplayName("unregistered source → UnknownSourceException")
        void unknownSource() {
            SourceRegistry registry = Fixtures.registry();
            UnknownSourceException e = assertThrows(UnknownSourceException.class,
                () -> registry.getSource("nobody"));
            assertEquals("nobody", e.getSubject());
            assertFalse(registry.isRegistered("nobody"));
            assertFalse(registry.isRegistered(null));
        }

        @Test
        @DisplayName("allSources() is ordered by id")
        void allSourcesOrdered() {
            List<String> ids = Fixtures.registry().allSources().stream().map(Source::sourceId).toList();
            assertEquals(List.of(Fixtures.AGG_A, Fixtures.AGG_B, Fixtures.ANALYST, Fixtures.RELIABLE, Fixtures.SEC), ids);
        }
    }

    // ── accuracy updates ──────────────────────────────────────────────────

    @Nested
    @DisplayName("updateAccuracy()")
    class UpdateTests {

        @Test
        @DisplayName("update is derived from the previous value and logged")
        void appendsToLog() {
            SourceRegistry registry = Fixtures.registry(0.5);
            registry.updateAccuracy(Fixtures.AGG_A, 0.1, "first");
            AccuracyAdjustment second = registry.updateAccuracy(Fixtures.AGG_A, -0.3, "second");

            assertEquals(0.6, second.previousAccuracy(), 1e-12);
            assertEquals(0.3, second.newAccuracy(), 1e-12);
            assertEquals(0.3, registry.getSource(Fixtures.AGG_A).historicalAccuracy(), 1e-12);
            assertEquals(2, registry.accuracyLog(Fixtures.AGG_A).size());
            assertEquals(Fixtures.NOW, second.adjustedAt());
        }

        @Test
        @DisplayName("accuracy is clamped to [0, 1]")
        void clamped() {
            SourceRegistry registry = Fixtures.registry(0.95);
            assertEquals(1.0, registry.updateAccuracy(Fixtures.AGG_A, 0.2, "up").newAccuracy());
            assertEquals(0.0, registry.updateAccuracy(Fixtures.AGG_B, -2.0, "down").newAccuracy());
        }

        @Test
        @DisplayName("unknown source cannot be updated")
        void unknown() {
            assertThrows(UnknownSourceException.class,
                () -> Fixtures.registry().updateAccuracy("nobody", 0.1, "x"));
        }

        @Test
        @DisplayName("restoreAccuracy() sets the persisted value")
        void restore() {
            SourceRegistry registry = Fixtures.registry();
            AccuracyAdjustment restored = registry.restoreAccuracy(Fixtures.ANALYST, 0.42);
            assertEquals(0.42, restored.newAccuracy(), 1e-12);
            assertEquals("restored", restored.reason());
            assertEquals(0.42, registry.getSource(Fixtures.ANALYST).historicalAccuracy(), 1e-12);
        }

        @Test
        @DisplayName("in-memory log keeps only the most recent changes, oldest first")
        void logIsBounded() {
            SourceRegistry registry = Fixtures.registry(0.5);
            int updates = SourceRegistry.RECENT_ADJUSTMENTS + 10;
            for (int i = 0; i < updates; i++) {
                registry.updateAccuracy(Fixtures.ANALYST, 0.001, "step " + i);
            }

            List<AccuracyAdjustment> log = registry.accuracyLog(Fixtures.ANALYST);
            assertEquals(SourceRegistry.RECENT_ADJUSTMENTS, log.size());
            assertEquals("step 10", log.get(0).reason());
            assertEquals("step " + (updates - 1), log.get(log.size() - 1).reason());
            assertEquals(0.5 + 0.001 * updates, registry.getSource(Fixtures.ANALYST).historicalAccuracy(), 1e-9);
        }

        @Test
        @DisplayName("concurrent writers of one source are serialised without lost updates")
        void concurrentUpdates() throws Exception {
            SourceRegistry registry = Fixtures.registry(0.0);
            int threads = 8;
            int perThread = 1000;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            registry.updateAccuracy(Fixtures.AGG_A, 0.0001, "load");
                            double seen = registry.getSource(Fixtures.AGG_A).historicalAccuracy();
                            assertTrue(seen >= 0.0 && seen <= 1.0);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(0.8, registry.getSource(Fixtures.AGG_A).historicalAccuracy(), 1e-9);
            List<AccuracyAdjustment> log = registry.accuracyLog(Fixtures.AGG_A);
            assertEquals(SourceRegistry.RECENT_ADJUSTMENTS, log.size());
            assertEquals(0.8, log.get(log.size() - 1).newAccuracy(), 1e-9);
            assertEquals(0.0, registry.getSource(Fixtures.AGG_B).historicalAccuracy());
        }
    }
}
