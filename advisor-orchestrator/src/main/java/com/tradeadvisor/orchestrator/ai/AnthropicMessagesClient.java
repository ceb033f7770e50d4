package com.tradeadvisor.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.orchestrator.capability.ExternalServiceErrors;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Thin reactive wrapper over the Anthropic {@code /v1/messages} endpoint.
 *
 * <p>Sends one user turn made of the given content blocks and returns the concatenated
 * text of the reply. Every failure surfaces as {@link ExternalServiceException} tagged
 * with the calling capability; no fallback answer is ever produced.
 */
@Component
public class AnthropicMessagesClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicMessagesClient.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final PlannerProperties.Anthropic settings;

    public AnthropicMessagesClient(@Qualifier("anthropicClient") WebClient anthropicClient,
                                   ObjectMapper objectMapper,
                                   PlannerProperties properties) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.settings = properties.anthropic();
    }

    /** Text-only convenience overload. */
    public Mono<String> send(String model, String prompt, ExternalCapability capability) {
        return send(model, List.of(textBlock(prompt)), capability);
    }

    public Mono<String> send(String model, List<Map<String, Object>> content, ExternalCapability capability) {
        if (!settings.hasApiKey()) {
            return Mono.error(new ExternalServiceException(capability,
                "Anthropic API key is not configured", false));
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", settings.maxTokens(),
            "messages", List.of(Map.of("role", "user", "content", content))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", settings.apiKey())
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(settings.timeout())
            )
            .map(response -> extractText(response, capability))
            .doOnSuccess(text -> log.debug("[Anthropic] Reply received. capability={} model={} chars={}",
                                           capability, model, text != null ? text.length() : 0))
            .onErrorMap(e -> ExternalServiceErrors.classify(e, capability));
    }

    public static Map<String, Object> textBlock(String text) {
        return Map.of("type", "text", "text", text);
    }

    public static Map<String, Object> imageBlock(String mediaType, String base64Data) {
        return Map.of("type", "image",
                      "source", Map.of("type", "base64", "media_type", mediaType, "data", base64Data));
    }

    private String extractText(String response, ExternalCapability capability) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ExternalServiceException(capability, "Anthropic response is not JSON", false, e);
        }
        JsonNode blocks = root.path("content");
        if (!blocks.isArray() || blocks.isEmpty()) {
            throw new ExternalServiceException(capability, "Anthropic response has no content blocks", false);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }
}
