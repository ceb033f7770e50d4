package com.tradeadvisor.orchestrator.pipeline;

import com.tradeadvisor.common.exception.ErrorKind;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.common.exception.PipelineException;
import com.tradeadvisor.common.exception.PipelineStage;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.common.model.PlanStatus;
import com.tradeadvisor.common.model.TradeDirection;
import com.tradeadvisor.common.risk.RiskTable;
import com.tradeadvisor.orchestrator.FakeResearchClient;
import com.tradeadvisor.orchestrator.FakeVisionAnalyzer;
import com.tradeadvisor.orchestrator.ScriptedReasoningEngine;
import com.tradeadvisor.orchestrator.ai.AnalystDraft;
import com.tradeadvisor.orchestrator.capability.ChartImage;
import com.tradeadvisor.orchestrator.capability.ExplicitAccountInfoProvider;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import com.tradeadvisor.orchestrator.logger.PipelineFlowLogger;
import com.tradeadvisor.orchestrator.stage.AnalystStage;
import com.tradeadvisor.orchestrator.stage.RiskStage;
import com.tradeadvisor.orchestrator.stage.StageRetryPolicy;
import com.tradeadvisor.orchestrator.stage.TraderStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.tradeadvisor.orchestrator.PlannerTestFixtures.FIXED_CLOCK;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.NOW;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.analystDraft;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.bd;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.pngChart;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.properties;
import static com.tradeadvisor.orchestrator.PlannerTestFixtures.setupDraft;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs through real stages with deterministic capabilities and reasoner.
 */
class StageOrchestratorTest {

    private FakeVisionAnalyzer vision = new FakeVisionAnalyzer();
    private FakeResearchClient research = new FakeResearchClient();

    private StageOrchestrator orchestrator(ScriptedReasoningEngine reasoning) {
        return orchestrator(reasoning, properties());
    }

    private StageOrchestrator orchestrator(ScriptedReasoningEngine reasoning, PlannerProperties props) {
        StageRetryPolicy retry = new StageRetryPolicy(props);
        return new StageOrchestrator(
            new ExplicitAccountInfoProvider(),
            new AnalystStage(vision, research, reasoning, retry, props, FIXED_CLOCK),
            new TraderStage(reasoning, retry, FIXED_CLOCK),
            new RiskStage(RiskTable.defaults(), FIXED_CLOCK),
            retry,
            new PipelineFlowLogger(),
            FIXED_CLOCK);
    }

    private static PlanRequest request(String symbol, String equity) {
        return new PlanRequest(pngChart(), symbol, new BigDecimal(equity), "");
    }

    private static PipelineException runExpectingFailure(StageOrchestrator orchestrator, PlanRequest request,
                                                        CancellationToken token) {
        return assertThrows(PipelineException.class, () -> orchestrator.run(request, token).block());
    }

    @Nested
    @DisplayName("successful runs")
    class Success {

        @Test
        @DisplayName("MEDIUM LONG on 100000 equity, entry 100 stop 95 → 200 units, 1000 at risk")
        void completePlan() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "100", "95", "110", "120"));

            CompleteTradePlan plan = orchestrator(reasoning).run(request("aapl", "100000"), new CancellationToken()).block();

            assertNotNull(plan);
            assertEquals("AAPL", plan.symbol());
            assertEquals(PlanStatus.COMPLETE, plan.status());
            assertEquals(200, plan.allocation().positionSize());
            assertEquals(0, plan.allocation().actualRiskAmount().compareTo(bd("1000")));
            assertEquals(0, plan.setup().riskPerShare().compareTo(bd("5")));
            assertEquals(NOW, plan.createdAt());
        }

        @Test
        @DisplayName("HIGH conviction on 5000 equity with 150 risk per unit → size 0, UNSIZEABLE")
        void unsizeablePlan() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "HIGH"), setupDraft("LONG", "300", "150", "600"));

            CompleteTradePlan plan = orchestrator(reasoning).run(request("BRK", "5000"), new CancellationToken()).block();

            assertEquals(PlanStatus.UNSIZEABLE, plan.status());
            assertEquals(0, plan.allocation().positionSize());
            assertEquals(0, plan.allocation().riskAmount().compareTo(bd("100")));
        }

        @Test
        @DisplayName("NO_TRADE short-circuits: trader never called, setup and allocation absent")
        void noTrade() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("NO_TRADE", "LOW"), null);

            StepVerifier.create(orchestrator(reasoning).run(request("AAPL", "100000"), new CancellationToken()))
                .assertNext(plan -> {
                    assertEquals(PlanStatus.NO_TRADE, plan.status());
                    assertNull(plan.setup());
                    assertNull(plan.allocation());
                    assertTrue(plan.executiveSummary().startsWith("NO TRADE"));
                })
                .verifyComplete();
            assertEquals(0, reasoning.setupCalls.get());
        }

        @Test
        @DisplayName("trader sees the analyst call and the chart description")
        void traderContext() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("SHORT", "LOW"), setupDraft("SHORT", "200", "210", "190"));

            orchestrator(reasoning).run(request("TSLA", "50000"), new CancellationToken()).block();

            assertEquals("TSLA", reasoning.lastSetupBrief().symbol());
            assertEquals(TradeDirection.SHORT, reasoning.lastSetupBrief().analyst().direction());
            assertTrue(reasoning.lastSetupBrief().chartDescription().contains("support at 95"));
        }
    }

    @Nested
    @DisplayName("failures carry stage, kind and completed artifacts")
    class Failures {

        @Test
        @DisplayName("LONG with stop above entry fails at TRADER with VALIDATION, analyst kept, no allocation")
        void invalidOrdering() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "50", "55", "60"));

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());

            assertEquals(PipelineStage.TRADER, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertNotNull(ex.getCompleted().analyst());
            assertNull(ex.getCompleted().setup());
            assertNull(ex.getCompleted().allocation());
        }

        @Test
        @DisplayName("setup direction opposite to the analyst call fails at TRADER")
        void directionContradiction() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("SHORT", "100", "105", "90"));

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.TRADER, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
        }

        @Test
        @DisplayName("conviction NONE is rejected at ANALYST")
        void convictionOutOfRange() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("NO_TRADE", "NONE"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.ANALYST, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertTrue(ex.getCompleted().isEmpty());
        }

        @Test
        @DisplayName("blank entry in the analyst observations is a VALIDATION failure at ANALYST")
        void nullObservation() {
            AnalystDraft base = analystDraft("LONG", "MEDIUM");
            AnalystDraft draft = new AnalystDraft("LONG", "MEDIUM", base.technicalFactors(), null,
                                                  Arrays.asList("Breakout retest holding", null), "Aligned");
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(draft, null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.ANALYST, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertSame(draft, ((ValidationException) ex.getCause()).getOffendingArtifact());
        }

        @Test
        @DisplayName("blank key level is a VALIDATION failure at ANALYST")
        void nullKeyLevel() {
            AnalystDraft.TechnicalDraft technicals = new AnalystDraft.TechnicalDraft("Uptrend",
                Arrays.asList((AnalystDraft.LevelDraft) null), "Bull flag", "RSI 61", "Average", "Low");
            AnalystDraft draft = new AnalystDraft("LONG", "MEDIUM", technicals, null, List.of(), "Aligned");
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(draft, null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.ANALYST, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
        }

        @Test
        @DisplayName("reasoner returning no analyst draft is a VALIDATION failure at ANALYST")
        void emptyAnalystDraft() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(null, null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.ANALYST, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertEquals(1, reasoning.analyzeCalls.get());
        }

        @Test
        @DisplayName("reasoner returning no setup draft is a VALIDATION failure at TRADER, analyst kept")
        void emptySetupDraft() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.TRADER, ex.getStage());
            assertEquals(ErrorKind.VALIDATION, ex.getKind());
            assertNotNull(ex.getCompleted().analyst());
            assertNull(ex.getCompleted().allocation());
        }

        @Test
        @DisplayName("non-positive equity fails at INPUT before any capability is called")
        void zeroEquity() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "HIGH"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "0"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.INPUT, ex.getStage());
            assertEquals(ErrorKind.INPUT, ex.getKind());
            assertEquals(0, vision.calls.get());
        }

        @Test
        @DisplayName("chart that is neither PNG nor JPEG fails at INPUT")
        void badChart() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "HIGH"), null);
            PlanRequest request = new PlanRequest(new ChartImage("GIF89a".getBytes(), "chart.gif"),
                                                  "AAPL", bd("1000"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request, new CancellationToken());
            assertEquals(ErrorKind.INPUT, ex.getKind());
        }

        @Test
        @DisplayName("blank symbol fails at INPUT")
        void blankSymbol() {
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "HIGH"), null);
            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("  ", "1000"),
                                                       new CancellationToken());
            assertEquals(PipelineStage.INPUT, ex.getStage());
        }
    }

    @Nested
    @DisplayName("retries at the stage boundary")
    class Retries {

        @Test
        @DisplayName("transient vision failures are retried and the run succeeds within budget")
        void transientRecovered() {
            vision.failNext(new ExternalServiceException(ExternalCapability.VISION, "HTTP 503", true),
                            new TimeoutException("slow"));
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "100", "95", "110"));

            CompleteTradePlan plan = orchestrator(reasoning).run(request("AAPL", "100000"), new CancellationToken()).block();

            assertEquals(PlanStatus.COMPLETE, plan.status());
            assertEquals(3, vision.calls.get());
        }

        @Test
        @DisplayName("permanent vision failure is not retried")
        void permanentNotRetried() {
            vision.failNext(new ExternalServiceException(ExternalCapability.VISION, "HTTP 400", false));
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());

            assertEquals(PipelineStage.ANALYST, ex.getStage());
            assertEquals(ErrorKind.EXTERNAL_SERVICE, ex.getKind());
            assertEquals(ExternalCapability.VISION, ex.getCapability());
            assertEquals(1, vision.calls.get());
            assertEquals(0, reasoning.analyzeCalls.get());
        }

        @Test
        @DisplayName("exhausted retries surface the last transient failure")
        void exhausted() {
            ExternalServiceException outage = new ExternalServiceException(ExternalCapability.VISION, "HTTP 503", true);
            vision.failNext(outage, outage, outage);
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());

            assertEquals(3, vision.calls.get());
            assertSame(outage, ex.getCause());
        }

        @Test
        @DisplayName("search failure fails the analyst stage and reasoning never runs")
        void searchFailure() {
            research.failSearch(new ExternalServiceException(ExternalCapability.SEARCH, "HTTP 401", false));
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"),
                                                       new CancellationToken());
            assertEquals(ExternalCapability.SEARCH, ex.getCapability());
            assertEquals(0, reasoning.analyzeCalls.get());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("token cancelled before the run fails at INPUT with nothing completed")
        void cancelledUpFront() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("LONG", "MEDIUM"), null);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"), token);

            assertEquals(ErrorKind.CANCELLED, ex.getKind());
            assertEquals(PipelineStage.INPUT, ex.getStage());
            assertEquals(0, vision.calls.get());
        }

        @Test
        @DisplayName("cancel during the analyst stage stops before TRADER and keeps the recommendation")
        void cancelledBetweenStages() {
            CancellationToken token = new CancellationToken();
            ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(
                analystDraft("LONG", "MEDIUM"), setupDraft("LONG", "100", "95", "110"))
                .afterAnalyze(token::cancel);

            PipelineException ex = runExpectingFailure(orchestrator(reasoning), request("AAPL", "100000"), token);

            assertEquals(ErrorKind.CANCELLED, ex.getKind());
            assertEquals(PipelineStage.TRADER, ex.getStage());
            assertNotNull(ex.getCompleted().analyst());
            assertEquals(0, reasoning.setupCalls.get());
        }
    }

    @Test
    @DisplayName("research disabled: no search or scrape, analyst still runs")
    void researchDisabled() {
        ScriptedReasoningEngine reasoning = new ScriptedReasoningEngine(analystDraft("NO_TRADE", "LOW"), null);
        PlanRequest withUrl = new PlanRequest(pngChart(), "AAPL", bd("1000"), "see https://blog.test/aapl");

        orchestrator(reasoning, properties(false, 3)).run(withUrl, new CancellationToken()).block();

        assertEquals(0, research.searches.get());
        assertTrue(research.scrapedUrls.isEmpty());
        assertFalse(reasoning.lastAnalystBrief().hasResearch());
    }
}
