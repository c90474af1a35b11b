package com.metricrecon.reconciliation.service;

import com.metricrecon.common.registry.SourceRegistry;
import com.metricrecon.common.review.ReviewQueueManager;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Reloads learned state before the service takes traffic: persisted source accuracies replace the
 * configured initial values, and pending review tasks go back into the queue. Closed tasks stay in
 * the store; a late decision on one is rejected from its stored status. Sources seen for the first
 * time are written with their configured accuracy.
 */
@Component
public class ReconciliationStateRestorer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationStateRestorer.class);

    private static final Duration RESTORE_TIMEOUT = Duration.ofSeconds(30);

    private final ReconciliationStore store;
    private final SourceRegistry registry;
    private final ReviewQueueManager reviewQueue;

    public ReconciliationStateRestorer(ReconciliationStore store,
                                       SourceRegistry registry,
                                       ReviewQueueManager reviewQueue) {
        this.store       = store;
        this.registry    = registry;
        this.reviewQueue = reviewQueue;
    }

    @PostConstruct
    public void restore() {
        Long sources = store.persistedTrust()
            .filter(record -> {
                if (!registry.isRegistered(record.getSourceId())) {
                    log.warn("Persisted source no longer configured; ignored. sourceId={}", record.getSourceId());
                    return false;
                }
                return true;
            })
            .doOnNext(record -> registry.restoreAccuracy(record.getSourceId(), record.getHistoricalAccuracy()))
            .count()
            .block(RESTORE_TIMEOUT);

        Flux.fromIterable(registry.allSources())
            .concatMap(store::saveSourceTrust)
            .then()
            .block(RESTORE_TIMEOUT);

        Long tasks = store.pendingReviewTasks()
            .filter(reviewQueue::restore)
            .count()
            .block(RESTORE_TIMEOUT);

        log.info("STATE_RESTORED sourcesRestored={} reviewTasksRestored={} pending={}",
                 sources, tasks, reviewQueue.pendingCount());
    }
}
