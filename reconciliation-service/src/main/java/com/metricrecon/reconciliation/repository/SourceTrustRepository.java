package com.metricrecon.reconciliation.repository;

import com.metricrecon.reconciliation.model.SourceTrustRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SourceTrustRepository extends ReactiveCrudRepository<SourceTrustRecord, String> {

    /**
     * Atomic UPSERT of a source's latest accuracy. Category and base weight are refreshed
     * from configuration on every write.
     */
    @Modifying
    @Query("""
        INSERT INTO sources (source_id, category, base_weight, historical_accuracy, updated_at)
        VALUES (:sourceId, :category, :baseWeight, :historicalAccuracy, NOW())
        ON CONFLICT (source_id) DO UPDATE SET
            category            = EXCLUDED.category,
            base_weight         = EXCLUDED.base_weight,
            historical_accuracy = EXCLUDED.historical_accuracy,
            updated_at          = NOW()
        """)
    Mono<Void> upsertAccuracy(String sourceId, String category, double baseWeight, double historicalAccuracy);
}
