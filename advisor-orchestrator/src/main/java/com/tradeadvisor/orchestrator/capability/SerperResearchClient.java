package com.tradeadvisor.orchestrator.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * News search and page scraping via Serper.
 *
 * <p>Search asks the news endpoint for the past month ({@code tbs=qdr:m}) and keeps
 * the first {@code planner.serper.max-results} hits. Scrape returns the page text,
 * prefixed with title and description when the provider supplies them.
 */
@Component
public class SerperResearchClient implements ResearchClient {

    private static final Logger log = LoggerFactory.getLogger(SerperResearchClient.class);

    private final WebClient serperClient;
    private final ObjectMapper objectMapper;
    private final PlannerProperties.Serper settings;

    public SerperResearchClient(@Qualifier("serperClient") WebClient serperClient,
                                ObjectMapper objectMapper,
                                PlannerProperties properties) {
        this.serperClient = serperClient;
        this.objectMapper = objectMapper;
        this.settings = properties.serper();
    }

    @Override
    public Mono<List<SearchResult>> search(String query) {
        return post(settings.searchUrl(), Map.of("q", query, "tbs", "qdr:m"), ExternalCapability.SEARCH)
            .map(this::parseNews)
            .doOnSuccess(results -> log.info("[Research] News search done. query={} hits={}",
                                             query, results.size()));
    }

    @Override
    public Mono<String> scrape(String url) {
        return post(settings.scrapeUrl(), Map.of("url", url), ExternalCapability.SCRAPE)
            .map(this::parsePage)
            .doOnSuccess(text -> log.info("[Research] Page scraped. url={} chars={}", url, text.length()));
    }

    private Mono<JsonNode> post(String url, Map<String, Object> body, ExternalCapability capability) {
        if (!settings.hasApiKey()) {
            return Mono.error(new ExternalServiceException(capability,
                "Serper API key is not configured", false));
        }
        return serperClient.post()
            .uri(url)
            .header("X-API-KEY", settings.apiKey())
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(settings.timeout())
            .map(response -> {
                try {
                    return objectMapper.readTree(response);
                } catch (Exception e) {
                    throw new ExternalServiceException(capability, "Serper response is not JSON", false, e);
                }
            })
            .onErrorMap(e -> ExternalServiceErrors.classify(e, capability));
    }

    private List<SearchResult> parseNews(JsonNode root) {
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode item : root.path("news")) {
            if (results.size() >= settings.maxResults()) break;
            results.add(new SearchResult(
                item.path("title").asText(""),
                item.path("snippet").asText(""),
                item.path("source").asText(""),
                item.path("date").asText(""),
                item.path("link").asText("")));
        }
        return List.copyOf(results);
    }

    private String parsePage(JsonNode root) {
        StringBuilder page = new StringBuilder();
        JsonNode metadata = root.path("metadata");
        String title = metadata.path("title").asText("");
        String description = metadata.path("description").asText("");
        if (!title.isBlank())       page.append("Title: ").append(title).append('\n');
        if (!description.isBlank()) page.append("Description: ").append(description).append('\n');
        page.append(root.path("text").asText(""));
        return page.toString().trim();
    }
}
