package com.tradeadvisor.orchestrator.capability;

import com.tradeadvisor.common.exception.ExternalCapability;
import com.tradeadvisor.common.exception.ExternalServiceException;
import com.tradeadvisor.orchestrator.ai.AnthropicMessagesClient;
import com.tradeadvisor.orchestrator.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.List;

/** Chart vision through a multimodal Claude model: one image block plus instructions. */
@Component
public class AnthropicVisionAnalyzer implements VisionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AnthropicVisionAnalyzer.class);

    private final AnthropicMessagesClient messagesClient;
    private final String visionModel;

    public AnthropicVisionAnalyzer(AnthropicMessagesClient messagesClient, PlannerProperties properties) {
        this.messagesClient = messagesClient;
        this.visionModel = properties.anthropic().visionModel();
    }

    @Override
    public Mono<String> analyze(ChartImage chart, String instructions) {
        return Mono.defer(() -> {
            String encoded = Base64.getEncoder().encodeToString(chart.data());
            return messagesClient.send(visionModel, List.of(
                    AnthropicMessagesClient.imageBlock(chart.mediaType(), encoded),
                    AnthropicMessagesClient.textBlock(instructions)),
                ExternalCapability.VISION);
        })
        .flatMap(text -> text.isBlank()
            ? Mono.error(new ExternalServiceException(ExternalCapability.VISION,
                  "Vision model returned an empty description", false))
            : Mono.just(text))
        .doOnSuccess(text -> log.info("[Vision] Chart described. file={} chars={}",
                                      chart.filename(), text.length()));
    }
}
