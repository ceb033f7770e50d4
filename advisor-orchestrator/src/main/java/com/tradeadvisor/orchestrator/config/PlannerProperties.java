package com.tradeadvisor.orchestrator.config;

import com.tradeadvisor.common.risk.RiskTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * All process configuration, bound once from {@code planner.*} at start-up and handed
 * to the components that need it. Stage logic never reads the environment directly.
 */
@ConfigurationProperties(prefix = "planner")
public record PlannerProperties(
    Anthropic anthropic,
    Serper    serper,
    Research  research,
    Retry     retry,
    Risk      risk
) {
    public PlannerProperties {
        anthropic = anthropic != null ? anthropic : new Anthropic(null, null, null, null, null, 0, null);
        serper    = serper    != null ? serper    : new Serper(null, null, null, 0, null);
        research  = research  != null ? research  : new Research(true, 0);
        retry     = retry     != null ? retry     : new Retry(0, null);
        risk      = risk      != null ? risk      : new Risk(null, null, null);
    }

    /** Anthropic Messages API, used for chart vision and for the reasoning engine. */
    public record Anthropic(String apiKey, String baseUrl, String version, String visionModel,
                            String reasoningModel, int maxTokens, Duration timeout) {
        public Anthropic {
            baseUrl        = baseUrl        != null ? baseUrl        : "https://api.anthropic.com";
            version        = version        != null ? version        : "2023-06-01";
            visionModel    = visionModel    != null ? visionModel    : "claude-sonnet-4-5";
            reasoningModel = reasoningModel != null ? reasoningModel : "claude-sonnet-4-5";
            maxTokens      = maxTokens > 0  ? maxTokens : 1500;
            timeout        = timeout        != null ? timeout        : Duration.ofSeconds(60);
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /** Serper news search and page scrape endpoints. */
    public record Serper(String apiKey, String searchUrl, String scrapeUrl, int maxResults, Duration timeout) {
        public Serper {
            searchUrl  = searchUrl != null ? searchUrl : "https://google.serper.dev/news";
            scrapeUrl  = scrapeUrl != null ? scrapeUrl : "https://scrape.serper.dev";
            maxResults = maxResults > 0 ? maxResults : 5;
            timeout    = timeout   != null ? timeout   : Duration.ofSeconds(10);
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /** Whether the analyst stage gathers news and scrapes prompt URLs. */
    public record Research(Boolean enabled, int maxScrapes) {
        public Research {
            enabled    = enabled != null ? enabled : Boolean.TRUE;
            maxScrapes = maxScrapes > 0 ? maxScrapes : 3;
        }
    }

    /** Retry budget for transient capability failures, applied at each stage boundary. */
    public record Retry(int maxAttempts, Duration initialBackoff) {
        public Retry {
            maxAttempts    = maxAttempts > 0 ? maxAttempts : 3;
            initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofMillis(500);
        }
    }

    /** Conviction → risk fraction table. Values are clamped by {@link RiskTable}. */
    public record Risk(BigDecimal lowPct, BigDecimal mediumPct, BigDecimal highPct) {
        public RiskTable toTable() {
            return new RiskTable(lowPct, mediumPct, highPct);
        }
    }
}
