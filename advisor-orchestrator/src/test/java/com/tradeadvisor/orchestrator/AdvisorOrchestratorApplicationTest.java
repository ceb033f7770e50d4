package com.tradeadvisor.orchestrator;

import com.tradeadvisor.common.model.ConvictionLevel;
import com.tradeadvisor.common.risk.RiskTable;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import com.tradeadvisor.orchestrator.pipeline.StageOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "planner.anthropic.api-key=ctx-test-key",
    "planner.retry.max-attempts=4",
    "planner.risk.high-pct=0.05"
})
class AdvisorOrchestratorApplicationTest {

    @Autowired
    private PlannerProperties properties;

    @Autowired
    private RiskTable riskTable;

    @Autowired
    private StageOrchestrator orchestrator;

    @Test
    @DisplayName("planner.* binds from application.yml with overrides")
    void bindsProperties() {
        assertEquals("ctx-test-key", properties.anthropic().apiKey());
        assertEquals(Duration.ofSeconds(60), properties.anthropic().timeout());
        assertEquals(4, properties.retry().maxAttempts());
        assertEquals(Duration.ofMillis(500), properties.retry().initialBackoff());
        assertEquals(5, properties.serper().maxResults());
        assertTrue(properties.research().enabled());
        assertNotNull(orchestrator);
    }

    @Test
    @DisplayName("an out-of-range configured risk is clamped to 2%")
    void riskTableClamped() {
        assertEquals(0, new BigDecimal("0.02").compareTo(riskTable.riskPctFor(ConvictionLevel.HIGH)));
    }
}
