package com.tradeadvisor.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ValidationException;
import com.tradeadvisor.common.model.AnalystRecommendation;
import com.tradeadvisor.common.model.PriceLevel;
import com.tradeadvisor.orchestrator.capability.SearchResult;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Claude-backed reasoning for the analyst and trader stages.
 *
 * <p>Each call sends a single prompt that asks for a strict JSON object and parses the
 * reply into a draft. Markdown code fences around the JSON are tolerated. A reply that
 * still cannot be parsed is a {@link ValidationException} carrying the raw text; it is
 * never replaced by a default answer.
 */
@Service
public class AnthropicReasoningEngine implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningEngine.class);

    private final AnthropicMessagesClient messagesClient;
    private final ObjectMapper objectMapper;
    private final String reasoningModel;

    public AnthropicReasoningEngine(AnthropicMessagesClient messagesClient,
                                    ObjectMapper objectMapper,
                                    PlannerProperties properties) {
        this.messagesClient = messagesClient;
        this.objectMapper = objectMapper;
        this.reasoningModel = properties.anthropic().reasoningModel();
    }

    @Override
    public Mono<AnalystDraft> analyze(AnalystBrief brief) {
        return Mono.fromCallable(() -> buildAnalystPrompt(brief))
            .flatMap(prompt -> messagesClient.send(reasoningModel, prompt, ExternalCapability.REASONING))
            .map(text -> parse(text, AnalystDraft.class))
            .doOnSuccess(d -> log.info("[Reasoning] Analyst draft parsed. symbol={} direction={} conviction={}",
                                       brief.symbol(), d.direction(), d.conviction()));
    }

    @Override
    public Mono<SetupDraft> planSetup(SetupBrief brief) {
        return Mono.fromCallable(() -> buildSetupPrompt(brief))
            .flatMap(prompt -> messagesClient.send(reasoningModel, prompt, ExternalCapability.REASONING))
            .map(text -> parse(text, SetupDraft.class))
            .doOnSuccess(d -> log.info("[Reasoning] Setup draft parsed. symbol={} entry={} stop={}",
                                       brief.symbol(), d.entry(), d.stopLoss()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildAnalystPrompt(AnalystBrief brief) {
        String research = brief.hasResearch()
            ? formatResearch(brief)
            : "No external research is available. Base the call on the chart alone and leave fundamentalFactors null.";
        return String.format("""
            You are a senior market analyst. Decide whether %s offers a tradeable setup.

            Chart analysis:
            %s

            Research:
            %s

            Trader's request:
            %s

            Choose direction LONG, SHORT or NO_TRADE and a conviction of LOW, MEDIUM or HIGH.
            A LONG or SHORT call must describe the trend. Prefer NO_TRADE when the evidence is mixed.

            Respond ONLY with valid JSON, no markdown, in exactly this shape:
            {
              "direction": "LONG|SHORT|NO_TRADE",
              "conviction": "LOW|MEDIUM|HIGH",
              "technicalFactors": {
                "trend": "<trend description>",
                "keyLevels": [{"price": <number>, "label": "<support|resistance|...>"}],
                "patternNotes": "<chart patterns>",
                "momentum": "<momentum read or null>",
                "volume": "<volume read or null>",
                "volatility": "<volatility read or null>"
              },
              "fundamentalFactors": {"earnings": "...", "macro": "...", "news": "...", "sector": "..."},
              "keyObservations": ["<observation>", "..."],
              "rationale": "<why this call>"
            }
            """,
            brief.symbol(), brief.chartDescription(), research,
            brief.userPrompt().isBlank() ? "(none)" : brief.userPrompt());
    }

    String buildSetupPrompt(SetupBrief brief) {
        AnalystRecommendation analyst = brief.analyst();
        String levels = analyst.technicalFactors().keyLevels().isEmpty()
            ? "  (none identified)"
            : analyst.technicalFactors().keyLevels().stream()
                .map(this::formatLevel)
                .collect(Collectors.joining("\n"));
        return String.format("""
            You are an experienced trader. Turn the analyst's %s call on %s into concrete price levels.

            Analyst call:
              direction  : %s
              conviction : %s
              trend      : %s
              patterns   : %s
              rationale  : %s
            Key levels:
            %s

            Chart analysis:
            %s

            Trader's request:
            %s

            Rules:
              - direction must stay %s
              - LONG : stopLoss < entry < takeProfits[0] < takeProfits[1] < ...
              - SHORT: stopLoss > entry > takeProfits[0] > takeProfits[1] > ...
              - give at least one take-profit, nearest first

            Respond ONLY with valid JSON, no markdown, in exactly this shape:
            {"direction": "%s", "entry": <number>, "stopLoss": <number>, "takeProfits": [<number>, ...], "rationale": "<why these levels>"}
            """,
            analyst.direction(), brief.symbol(),
            analyst.direction(), analyst.conviction(),
            analyst.technicalFactors().trend(),
            nullToDash(analyst.technicalFactors().patternNotes()),
            analyst.rationale(),
            levels,
            brief.chartDescription(),
            brief.userPrompt().isBlank() ? "(none)" : brief.userPrompt(),
            analyst.direction(), analyst.direction());
    }

    private String formatResearch(AnalystBrief brief) {
        StringBuilder sb = new StringBuilder();
        for (SearchResult r : brief.news()) {
            sb.append(String.format("  - [%s, %s] %s: %s%n", r.source(), r.date(), r.title(), r.snippet()));
        }
        for (ScrapedPage page : brief.pages()) {
            sb.append("  Page ").append(page.url()).append(":\n").append(page.text()).append('\n');
        }
        return sb.toString();
    }

    private String formatLevel(PriceLevel level) {
        return "  - " + level.price().toPlainString() + (level.label().isEmpty() ? "" : " (" + level.label() + ")");
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    // ── response parsing ──────────────────────────────────────────────────────

    <T> T parse(String responseText, Class<T> type) {
        String cleaned = responseText
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ValidationException("Reasoning output contains no JSON object", responseText);
        }
        try {
            return objectMapper.readValue(cleaned.substring(start, end + 1), type);
        } catch (Exception e) {
            log.warn("[Reasoning] Unparseable reply. type={} reason={}", type.getSimpleName(), e.getMessage());
            throw new ValidationException("Reasoning output is not valid " + type.getSimpleName()
                + " JSON: " + e.getMessage(), responseText);
        }
    }
}
