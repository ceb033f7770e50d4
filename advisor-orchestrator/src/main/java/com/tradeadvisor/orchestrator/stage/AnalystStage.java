package com.tradeadvisor.orchestrator.stage;

import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.orchestrator.ai.AnalystBrief;
import com.tradeadvisor.orchestrator.ai.ReasoningEngine;
import com.tradeadvisor.orchestrator.ai.ScrapedPage;
import com.tradeadvisor.orchestrator.capability.ResearchClient;
import com.tradeadvisor.orchestrator.capability.SearchResult;
import com.tradeadvisor.orchestrator.capability.VisionAnalyzer;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First stage: chart vision, optional research, then analyst reasoning.
 *
 * <p>Vision, news search and page scrapes are independent and run concurrently; the
 * reasoning call waits for all of them. If any of them fails the stage fails and the
 * siblings are cancelled, so no partial recommendation is ever emitted.
 */
@Component
public class AnalystStage {

    private static final Logger log = LoggerFactory.getLogger(AnalystStage.class);

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\"'<>]+");

    private final VisionAnalyzer visionAnalyzer;
    private final ResearchClient researchClient;
    private final ReasoningEngine reasoningEngine;
    private final StageRetryPolicy retryPolicy;
    private final PlannerProperties.Research research;
    private final Clock clock;

    public AnalystStage(VisionAnalyzer visionAnalyzer,
                        ResearchClient researchClient,
                        ReasoningEngine reasoningEngine,
                        StageRetryPolicy retryPolicy,
                        PlannerProperties properties,
                        Clock clock) {
        this.visionAnalyzer = visionAnalyzer;
        this.researchClient = researchClient;
        this.reasoningEngine = reasoningEngine;
        this.retryPolicy = retryPolicy;
        this.research = properties.research();
        this.clock = clock;
    }

    public Mono<AnalystFindings> execute(PlanRunContext ctx) {
        String symbol = ctx.symbol();
        String traceId = ctx.traceId();
        String prompt = ctx.request().prompt();

        Mono<String> vision = retryPolicy.apply(
            Mono.defer(() -> visionAnalyzer.analyze(ctx.request().chart(), visionInstructions(symbol, prompt))),
            ExternalCapability.VISION, traceId);

        Mono<List<SearchResult>> news = research.enabled()
            ? retryPolicy.apply(Mono.defer(() -> researchClient.search(symbol + " stock news")),
                                ExternalCapability.SEARCH, traceId)
            : Mono.just(List.<SearchResult>of());

        List<String> urls = research.enabled() ? extractUrls(prompt, research.maxScrapes()) : List.of();
        Mono<List<ScrapedPage>> pages = Flux.fromIterable(urls)
            .flatMapSequential(url -> retryPolicy.apply(Mono.defer(() -> researchClient.scrape(url)),
                                                        ExternalCapability.SCRAPE, traceId)
                .map(text -> new ScrapedPage(url, text)))
            .collectList();

        return Mono.zip(vision, news, pages)
            .flatMap(inputs -> {
                AnalystBrief brief = new AnalystBrief(symbol, inputs.getT1(), inputs.getT2(), inputs.getT3(), prompt);
                return retryPolicy.apply(Mono.defer(() -> reasoningEngine.analyze(brief)),
                                         ExternalCapability.REASONING, traceId)
                    .switchIfEmpty(Mono.error(() -> new ValidationException("Reasoning returned no analyst draft", brief)))
                    .map(draft -> new AnalystFindings(
                        draft.toRecommendation(symbol, clock.instant()), brief.chartDescription()));
            })
            .doOnSuccess(f -> log.info("[AnalystStage] Recommendation ready. symbol={} direction={} conviction={} pages={} traceId={}",
                                       symbol, f.recommendation().direction(), f.recommendation().conviction(),
                                       urls.size(), traceId));
    }

    static String visionInstructions(String symbol, String prompt) {
        return String.format("""
            Analyse this price chart of %s. Describe:
              - the prevailing trend and its strength
              - support and resistance levels with prices
              - chart patterns and candlestick formations
              - momentum, volume and volatility where visible
            Report only what the chart shows.%s
            """, symbol, prompt.isBlank() ? "" : "\nTrader's note: " + prompt);
    }

    /** Distinct http(s) URLs in order of appearance, trailing punctuation removed. */
    static List<String> extractUrls(String text, int limit) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher m = URL_PATTERN.matcher(text == null ? "" : text);
        while (m.find() && urls.size() < limit) {
            urls.add(m.group().replaceAll("[.,;:!?)\\]]+$", ""));
        }
        return List.copyOf(urls);
    }
}
