package com.metricrecon.common.registry;

import com.metricrecon.common.exception.ReconciliationConfigException;
import com.metricrecon.common.exception.UnknownSourceException;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.model.SourceCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Versioned table of data providers loaded once at startup.
 *
 * <p>Category and base weight are immutable after {@link Builder#build()}. The only mutable
 * per-source state is {@code historicalAccuracy}, which sits behind a per-source
 * {@link ReentrantReadWriteLock}: resolution runs read it under the read lock, while
 * {@link #updateAccuracy} serialises writers of the same source and never blocks other sources.
 * The last {@value #RECENT_ADJUSTMENTS} changes per source are kept for introspection; the complete
 * history belongs to the caller's durable store.
 *
 * <p>Category weights feed the confidence scorer:
 * <pre>
 *   REGULATORY             1.0
 *   MULTI_SOURCE_AGGREGATE 0.9
 *   SINGLE_RELIABLE        0.8
 *   PREDICTIVE             0.6
 * </pre>
 * (defaults, overridable per deployment).
 */
public final class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    static final Map<SourceCategory, Double> DEFAULT_CATEGORY_WEIGHTS = Map.of(
        SourceCategory.REGULATORY,             1.0,
        SourceCategory.MULTI_SOURCE_AGGREGATE, 0.9,
        SourceCategory.SINGLE_RELIABLE,        0.8,
        SourceCategory.PREDICTIVE,             0.6
    );

    static final int RECENT_ADJUSTMENTS = 64;

    private final Map<String, SourceSlot> slots;
    private final Map<SourceCategory, Double> categoryWeights;
    private final Clock clock;

    private SourceRegistry(Map<String, SourceSlot> slots,
                           Map<SourceCategory, Double> categoryWeights,
                           Clock clock) {
        this.slots           = Collections.unmodifiableMap(slots);
        this.categoryWeights = Collections.unmodifiableMap(categoryWeights);
        this.clock           = clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnknownSourceException when {@code sourceId} was never registered
     */
    public Source getSource(String sourceId) {
        return slot(sourceId).snapshot();
    }

    public boolean isRegistered(String sourceId) {
        return sourceId != null && slots.containsKey(sourceId);
    }

    public double categoryWeight(SourceCategory category) {
        return categoryWeights.getOrDefault(category, DEFAULT_CATEGORY_WEIGHTS.get(category));
    }

    /** Snapshots of every source, ordered by id. */
    public List<Source> allSources() {
        return slots.values().stream()
            .map(SourceSlot::snapshot)
            .sorted(Comparator.comparing(Source::sourceId))
            .toList();
    }

    /**
     * Moves a source's historical accuracy by {@code delta}, clamped to [0.0, 1.0].
     * Writers of the same source are serialised; the new value is always computed
     * from the value current at lock time.
     *
     * @return the appended log entry
     */
    public AccuracyAdjustment updateAccuracy(String sourceId, double delta, String reason) {
        SourceSlot slot = slot(sourceId);
        AccuracyAdjustment adjustment = slot.adjust(delta, reason, Instant.now(clock));
        log.info("SOURCE_ACCURACY_UPDATED sourceId={} accuracy={}→{} delta={} reason={}",
                 sourceId, adjustment.previousAccuracy(), adjustment.newAccuracy(), delta, reason);
        return adjustment;
    }

    /**
     * Loads a persisted accuracy at startup, before any resolution runs.
     */
    public AccuracyAdjustment restoreAccuracy(String sourceId, double accuracy) {
        SourceSlot slot = slot(sourceId);
        double delta = clamp(accuracy) - slot.snapshot().historicalAccuracy();
        return slot.adjust(delta, "restored", Instant.now(clock));
    }

    /** Most recent changes of one source, oldest first. */
    public List<AccuracyAdjustment> accuracyLog(String sourceId) {
        return slot(sourceId).log();
    }

    private SourceSlot slot(String sourceId) {
        SourceSlot slot = sourceId == null ? null : slots.get(sourceId);
        if (slot == null) {
            throw new UnknownSourceException(sourceId);
        }
        return slot;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    // ── per-source state ─────────────────────────────────────────────────────

    private static final class SourceSlot {

        private final String sourceId;
        private final SourceCategory category;
        private final double baseWeight;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        // guarded by lock
        private double historicalAccuracy;
        private final Deque<AccuracyAdjustment> adjustments = new ArrayDeque<>();

        SourceSlot(String sourceId, SourceCategory category, double baseWeight, double historicalAccuracy) {
            this.sourceId           = sourceId;
            this.category           = category;
            this.baseWeight         = baseWeight;
            this.historicalAccuracy = historicalAccuracy;
        }

        Source snapshot() {
            lock.readLock().lock();
            try {
                return new Source(sourceId, category, baseWeight, historicalAccuracy);
            } finally {
                lock.readLock().unlock();
            }
        }

        AccuracyAdjustment adjust(double delta, String reason, Instant at) {
            lock.writeLock().lock();
            try {
                double previous = historicalAccuracy;
                historicalAccuracy = clamp(previous + delta);
                AccuracyAdjustment adjustment =
                    new AccuracyAdjustment(sourceId, previous, historicalAccuracy, delta, reason, at);
                if (adjustments.size() == RECENT_ADJUSTMENTS) {
                    adjustments.removeFirst();
                }
                adjustments.addLast(adjustment);
                return adjustment;
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<AccuracyAdjustment> log() {
            lock.readLock().lock();
            try {
                return List.copyOf(adjustments);
            } finally {
                lock.readLock().unlock();
            }
        }
    }

    // ── builder ──────────────────────────────────────────────────────────────

    public static final class Builder {

        private final Map<String, SourceSlot> slots = new LinkedHashMap<>();
        private final Map<SourceCategory, Double> categoryWeights = new EnumMap<>(DEFAULT_CATEGORY_WEIGHTS);
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder categoryWeight(SourceCategory category, double weight) {
            if (category == null || !inUnitInterval(weight)) {
                throw new ReconciliationConfigException(String.valueOf(category),
                    "category weight must be in [0,1] but was " + weight);
            }
            categoryWeights.put(category, weight);
            return this;
        }

        public Builder register(String sourceId, SourceCategory category,
                                double baseWeight, double historicalAccuracy) {
            if (sourceId == null || sourceId.isBlank()) {
                throw new ReconciliationConfigException(String.valueOf(sourceId), "source id must not be blank");
            }
            if (category == null) {
                throw new ReconciliationConfigException(sourceId, "source category is required");
            }
            if (!inUnitInterval(baseWeight)) {
                throw new ReconciliationConfigException(sourceId, "base weight must be in [0,1] but was " + baseWeight);
            }
            if (!inUnitInterval(historicalAccuracy)) {
                throw new ReconciliationConfigException(sourceId,
                    "historical accuracy must be in [0,1] but was " + historicalAccuracy);
            }
            if (slots.containsKey(sourceId)) {
                throw new ReconciliationConfigException(sourceId, "source registered twice");
            }
            slots.put(sourceId, new SourceSlot(sourceId, category, baseWeight, historicalAccuracy));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SourceRegistry build() {
            log.info("Source registry loaded. sources={} categoryWeights={}", slots.keySet(), categoryWeights);
            return new SourceRegistry(new LinkedHashMap<>(slots), new EnumMap<>(categoryWeights), clock);
        }

        private static boolean inUnitInterval(double value) {
            return value >= 0.0 && value <= 1.0;
        }
    }
}
