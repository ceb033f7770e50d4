package com.tradeadvisor.orchestrator;

import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PlannerProperties.class)
public class AdvisorOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisorOrchestratorApplication.class, args);
    }
}
