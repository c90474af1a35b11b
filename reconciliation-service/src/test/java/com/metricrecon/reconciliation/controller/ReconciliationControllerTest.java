package com.metricrecon.reconciliation.controller;

import com.metricrecon.common.exception.ConcurrentMetricUpdateException;
import com.metricrecon.common.exception.EmptyObservationSetException;
import com.metricrecon.common.exception.FailureKind;
import com.metricrecon.common.exception.ReviewAlreadyDecidedException;
import com.metricrecon.common.exception.ReviewTaskNotFoundException;
import com.metricrecon.common.exception.UnknownSourceException;
import com.metricrecon.common.model.ContributingSource;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.QualityGrade;
import com.metricrecon.common.model.ResolutionMethod;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewPriority;
import com.metricrecon.common.model.ReviewStatus;
import com.metricrecon.common.model.SourceCategory;
import com.metricrecon.reconciliation.TestEngines;
import com.metricrecon.reconciliation.dto.ResolutionDTO;
import com.metricrecon.reconciliation.service.ReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationControllerTest {

    private static final String RESOLVE_BODY = """
        {
          "metricName": "revenue",
          "entityId": "AAPL",
          "period": "2024Q1",
          "observations": [
            {"sourceId": "sec-edgar", "value": 100.0, "observedAt": "2024-04-30T12:00:00Z"}
          ]
        }
        """;

    @Mock
    private ReconciliationService service;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        client = WebTestClient.bindToController(new ReconciliationController(service))
            .controllerAdvice(new ReconciliationExceptionHandler())
            .build();
    }

    private static ResolvedMetric metric() {
        return new ResolvedMetric("revenue", "AAPL", "2024Q1", 100.0, 0.95, ResolutionMethod.OVERRIDE,
            List.of(new ContributingSource("sec-edgar", SourceCategory.REGULATORY, 100.0, 0.9, TestEngines.NOW, false)),
            List.of(), 0.93, QualityGrade.A_PLUS, List.of());
    }

    @Test
    @DisplayName("POST /resolve → 200 with the resolved metric")
    void resolve() {
        when(service.resolve(any())).thenReturn(Mono.just(new ResolutionDTO(5L, metric(), null)));

        client.post().uri("/api/v1/reconciliation/resolve")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RESOLVE_BODY)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.recordId").isEqualTo(5)
            .jsonPath("$.metric.finalValue").isEqualTo(100.0)
            .jsonPath("$.metric.resolutionMethod").isEqualTo("OVERRIDE")
            .jsonPath("$.metric.qualityGrade").isEqualTo("A+");
    }

    @Test
    @DisplayName("no usable observation → 422")
    void emptyObservationSet() {
        when(service.resolve(any())).thenReturn(Mono.error(
            new EmptyObservationSetException(new MetricKey("revenue", "AAPL", "2024Q1"), 1)));

        client.post().uri("/api/v1/reconciliation/resolve")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RESOLVE_BODY)
            .exchange()
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.error").isEqualTo("EmptyObservationSetException");
    }

    @Test
    @DisplayName("decision on a decided task → 409, unknown task → 404")
    void reviewErrors() {
        when(service.submitDecision(eq("done"), any()))
            .thenReturn(Mono.error(new ReviewAlreadyDecidedException("done", ReviewStatus.APPROVED)));
        when(service.submitDecision(eq("missing"), any()))
            .thenReturn(Mono.error(new ReviewTaskNotFoundException("missing")));

        client.post().uri("/api/v1/reconciliation/reviews/done")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"decision\":\"APPROVE\"}")
            .exchange()
            .expectStatus().isEqualTo(409);

        client.post().uri("/api/v1/reconciliation/reviews/missing")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"decision\":\"REJECT\",\"correctedValue\":1001.0}")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("concurrent update that outlived its retries → 409 with the exception type")
    void concurrentUpdate() {
        when(service.resolve(any())).thenReturn(Mono.error(new ConcurrentMetricUpdateException(
            new MetricKey("revenue", "AAPL", "2024Q1"), "record 7 was superseded by another writer")));

        client.post().uri("/api/v1/reconciliation/resolve")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RESOLVE_BODY)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.error").isEqualTo("ConcurrentMetricUpdateException");
    }

    @Test
    @DisplayName("GET /reviews passes the priority filter through")
    void pendingReviews() {
        when(service.pendingReviews(ReviewPriority.URGENT)).thenReturn(Flux.empty());

        client.get().uri("/api/v1/reconciliation/reviews?priority=URGENT")
            .exchange()
            .expectStatus().isOk();
        verify(service).pendingReviews(ReviewPriority.URGENT);
    }

    @Test
    @DisplayName("unknown source → 404")
    void unknownSource() {
        when(service.sourceTrust("ghost")).thenReturn(Mono.error(new UnknownSourceException("ghost")));

        client.get().uri("/api/v1/reconciliation/sources/ghost")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("no persisted metric → 404")
    void metricNotFound() {
        when(service.currentMetric("AAPL", "revenue", "2023Q4")).thenReturn(Mono.empty());

        client.get().uri("/api/v1/reconciliation/metrics/AAPL/revenue/2023Q4")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/reconciliation/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    @DisplayName("every failure kind maps to a status")
    void statusPerKind() {
        assertEquals(HttpStatus.NOT_FOUND,            ReconciliationExceptionHandler.statusFor(FailureKind.UNKNOWN_SOURCE));
        assertEquals(HttpStatus.NOT_FOUND,            ReconciliationExceptionHandler.statusFor(FailureKind.REVIEW_NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT,             ReconciliationExceptionHandler.statusFor(FailureKind.REVIEW_CLOSED));
        assertEquals(HttpStatus.CONFLICT,             ReconciliationExceptionHandler.statusFor(FailureKind.CONCURRENT_UPDATE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, ReconciliationExceptionHandler.statusFor(FailureKind.NO_USABLE_DATA));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ReconciliationExceptionHandler.statusFor(FailureKind.PERSISTENCE));
    }
}
