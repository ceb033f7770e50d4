package com.tradeadvisor.orchestrator.controller;

import com.tradeadvisor.common.exception.InputException;
import com.tradeadvisor.common.model.CompleteTradePlan;
import com.tradeadvisor.orchestrator.capability.ChartImage;
import com.tradeadvisor.orchestrator.pipeline.CancellationToken;
import com.tradeadvisor.orchestrator.service.TradePlanService;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Multipart form: {@code chart} (PNG/JPEG file), {@code symbol}, {@code equity},
 * optional {@code prompt}. A client disconnect cancels the run at the next stage boundary.
 */
@RestController
@RequestMapping("/api/v1/trade-plans")
public class TradePlanController {

    private final TradePlanService tradePlanService;

    public TradePlanController(TradePlanService tradePlanService) {
        this.tradePlanService = tradePlanService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CompleteTradePlan>> submit(ServerWebExchange exchange) {
        CancellationToken token = new CancellationToken();
        return readForm(exchange)
            .flatMap(form -> tradePlanService.submit(form.chart(), form.symbol(), form.equity(), form.prompt(), token))
            .map(ResponseEntity::ok)
            .doOnCancel(token::cancel);
    }

    @PostMapping(path = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> report(ServerWebExchange exchange) {
        CancellationToken token = new CancellationToken();
        return readForm(exchange)
            .flatMap(form -> tradePlanService.submitForReport(form.chart(), form.symbol(), form.equity(), form.prompt(), token))
            .map(ResponseEntity::ok)
            .doOnCancel(token::cancel);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── form parsing ──────────────────────────────────────────────────────────

    private record PlanForm(ChartImage chart, String symbol, BigDecimal equity, String prompt) {}

    private Mono<PlanForm> readForm(ServerWebExchange exchange) {
        return exchange.getMultipartData().flatMap(parts -> {
            String symbol = field(parts, "symbol");
            String prompt = field(parts, "prompt");
            BigDecimal equity = parseEquity(field(parts, "equity"));
            return readChart(parts.getFirst("chart"))
                .map(chart -> new PlanForm(chart, symbol, equity, prompt))
                .defaultIfEmpty(new PlanForm(null, symbol, equity, prompt));
        });
    }

    private static Mono<ChartImage> readChart(Part part) {
        if (!(part instanceof FilePart file)) {
            return Mono.empty();
        }
        return DataBufferUtils.join(file.content())
            .map(buffer -> {
                byte[] bytes = new byte[buffer.readableByteCount()];
                buffer.read(bytes);
                DataBufferUtils.release(buffer);
                return new ChartImage(bytes, file.filename());
            });
    }

    private static String field(MultiValueMap<String, Part> parts, String name) {
        return parts.getFirst(name) instanceof FormFieldPart f ? f.value() : null;
    }

    private static BigDecimal parseEquity(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new InputException("Equity is not a number. equity=" + raw);
        }
    }
}
