package com.metricrecon.reconciliation.repository;

import com.metricrecon.reconciliation.model.SourceAccuracyLogRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface SourceAccuracyLogRepository extends ReactiveCrudRepository<SourceAccuracyLogRecord, Long> {

    Flux<SourceAccuracyLogRecord> findBySourceIdOrderByIdAsc(String sourceId);
}
