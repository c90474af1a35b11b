package com.metricrecon.reconciliation.controller;

import com.metricrecon.common.engine.ReviewOutcome;
import com.metricrecon.common.model.AccuracyAdjustment;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewTask;
import com.metricrecon.reconciliation.dto.BatchItemResultDTO;
import com.metricrecon.reconciliation.dto.BatchResolveRequest;
import com.metricrecon.reconciliation.dto.ResolutionDTO;
import com.metricrecon.reconciliation.dto.ResolveRequest;
import com.metricrecon.reconciliation.dto.ReviewDecisionRequest;
import com.metricrecon.reconciliation.dto.SourceTrustDTO;
import com.metricrecon.reconciliation.service.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/reconciliation")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/resolve")
    public Mono<ResponseEntity<ResolutionDTO>> resolve(@RequestBody ResolveRequest request) {
        log.info("Resolve requested. entityId={} metric={} period={} observations={}",
                 request.entityId(), request.metricName(), request.period(),
                 request.observations() != null ? request.observations().size() : 0);
        return reconciliationService.resolve(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/resolve/batch")
    public Flux<BatchItemResultDTO> resolveBatch(@RequestBody BatchResolveRequest request) {
        log.info("Batch resolve requested. units={}", request.units() != null ? request.units().size() : 0);
        return reconciliationService.resolveBatch(request);
    }

    @GetMapping("/reviews")
    public Flux<ReviewTask> pendingReviews(@RequestParam(required = false) ReviewPriority priority) {
        log.info("Pending reviews requested. priority={}", priority);
        return reconciliationService.pendingReviews(priority);
    }

    @PostMapping("/reviews/{taskId}")
    public Mono<ResponseEntity<ReviewOutcome>> submitDecision(@PathVariable String taskId,
                                                              @RequestBody ReviewDecisionRequest request) {
        log.info("Review decision received. taskId={} decision={} corrected={}",
                 taskId, request.decision(), request.correctedValue() != null);
        return reconciliationService.submitDecision(taskId, request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/sources/{sourceId}")
    public Mono<ResponseEntity<SourceTrustDTO>> sourceTrust(@PathVariable String sourceId) {
        return reconciliationService.sourceTrust(sourceId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/sources/{sourceId}/adjustments")
    public Flux<AccuracyAdjustment> accuracyAdjustments(@PathVariable String sourceId) {
        return reconciliationService.accuracyAdjustments(sourceId);
    }

    @GetMapping("/metrics/{entityId}/{metricName}/{period}")
    public Mono<ResponseEntity<ResolvedMetric>> currentMetric(@PathVariable String entityId,
                                                              @PathVariable String metricName,
                                                              @PathVariable String period) {
        return reconciliationService.currentMetric(entityId, metricName, period)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
