package com.tradeadvisor.orchestrator.controller;

import com.tradeadvisor.common.exception.ErrorKind;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.common.risk.RiskTable;
import com.tradeadvisor.orchestrator.FakeResearchClient;
import com.tradeadvisor.orchestrator.FakeVisionAnalyzer;
import com.tradeadvisor.orchestrator.ScriptedReasoningEngine;
import com.tradeadvisor.orchestrator.capability.ExplicitAccountInfoProvider;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import com.tradeadvisor.orchestrator.logger.PipelineFlowLogger;
import com.tradeadvisor.orchestrator.pipeline.StageOrchestrator;
import com.tradeadvisor.orchestrator.service.TradePlanService;
import com.tradeadvisor.orchestrator.stage.AnalystStage;
import com.tradeadvisor.orchestrator.stage.RiskStage;
import com.tradeadvisor.orchestrator.stage.StageRetryPolicy;
import com.tradeadvisor.orchestrator.stage.TraderStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import static com.tradeadvisor.orchestrator.PlannerTestFixtures.FIXED_CLOCK;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.PNG_BYTES;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.analystDraft;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.properties;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.setupDraft;
import static org.junit.jupiter.api.Assertions.*;

class TradePlanControllerTest {

    private final FakeVisionAnalyzer vision = new FakeVisionAnalyzer();

    private WebTestClient client(ScriptedReasoningEngine reasoning) {
        PlannerProperties props = properties();
        StageRetryPolicy retry = new StageRetryPolicy(props);
        StageOrchestrator orchestrator = new StageOrchestrator(
            new ExplicitAccountInfoProvider(),
            new AnalystStage(vision, new FakeResearchClient(), reasoning, retry, props, FIXED_CLOCK),
            new TraderStage(reasoning, retry, FIXED_CLOCK),
            new RiskStage(RiskTable.defaults(), FIXED_CLOCK),
            retry, new PipelineFlowLogger(), FIXED_CLOCK);
        return WebTestClient.bindToController(new TradePlanController(new TradePlanService(orchestrator)))
            .controllerAdvice(new TradePlanExceptionHandler())
            .build();
    }

    private static MultipartBodyBuilder form(byte[] chart, String symbol, String equity) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (chart != null) {
            builder.part("chart", new ByteArrayResource(chart)).filename("chart.png");
        }
        builder.part("symbol", symbol);
        builder.part("equity", equity);
        builder.part("prompt", "Swing trade, 2-4 weeks");
        return builder;
    }

    private static ScriptedReasoningEngine longMedium() {
        return new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "100", "95", "110", "120"));
    }

    @Nested
    @DisplayName("POST /api/v1/trade-plans")
    class Submit {

        @Test
        @DisplayName("returns the assembled plan as JSON")
        void completePlan() {
            client(longMedium()).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "100000").build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.symbol").isEqualTo("AAPL")
                .jsonPath("$.status").isEqualTo("COMPLETE")
                .jsonPath("$.allocation.positionSize").isEqualTo(200)
                .jsonPath("$.setup.direction").isEqualTo("LONG")
                .jsonPath("$.analyst.conviction").isEqualTo("MEDIUM");
        }

        @Test
        @DisplayName("zero equity → 400 with stage INPUT")
        void zeroEquity() {
            client(longMedium()).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "0").build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.stage").isEqualTo("INPUT")
                .jsonPath("$.kind").isEqualTo("INPUT")
                .jsonPath("$.traceId").isNotEmpty();
        }

        @Test
        @DisplayName("non-numeric equity → 400 before a run starts")
        void equityNotANumber() {
            client(longMedium()).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "lots").build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("INPUT");
        }

        @Test
        @DisplayName("missing chart → 400")
        void missingChart() {
            client(longMedium()).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(null, "AAPL", "1000").build()))
                .exchange()
                .expectStatus().isBadRequest();
            assertEquals(0, vision.calls.get());
        }

        @Test
        @DisplayName("mis-ordered setup → 422 with the analyst artifact attached")
        void validationFailure() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "50", "55", "60"));

            client(reasoning).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "100000").build()))
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.stage").isEqualTo("TRADER")
                .jsonPath("$.kind").isEqualTo("VALIDATION")
                .jsonPath("$.completed.analyst.direction").isEqualTo("LONG")
                .jsonPath("$.completed.allocation").doesNotExist();
        }

        @Test
        @DisplayName("permanent vision failure → 502 naming the capability")
        void externalFailure() {
            vision.failNext(new ExternalServiceException(ExternalCapability.VISION, "HTTP 401", false));

            client(longMedium()).post().uri("/api/v1/trade-plans")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "100000").build()))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.stage").isEqualTo("ANALYST")
                .jsonPath("$.capability").isEqualTo("VISION");
        }
    }

    @Test
    @DisplayName("POST /report renders the plan as plain text")
    void report() {
        String body = client(longMedium()).post().uri("/api/v1/trade-plans/report")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(form(PNG_BYTES, "AAPL", "100000").build()))
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class)
            .returnResult()
            .getResponseBody();

        assertNotNull(body);
        assertTrue(body.startsWith("TRADE PLAN: AAPL"));
        assertTrue(body.contains("Position size:  200 units"));
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client(longMedium()).get().uri("/api/v1/trade-plans/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    @DisplayName("error kinds map to 400 / 422 / 502 / 409")
    void statusMapping() {
        assertEquals(400, TradePlanExceptionHandler.statusFor(ErrorKind.INPUT).value());
        assertEquals(422, TradePlanExceptionHandler.statusFor(ErrorKind.VALIDATION).value());
        assertEquals(502, TradePlanExceptionHandler.statusFor(ErrorKind.EXTERNAL_SERVICE).value());
        assertEquals(409, TradePlanExceptionHandler.statusFor(ErrorKind.CANCELLED).value());
    }
}
