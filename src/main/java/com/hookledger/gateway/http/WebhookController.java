package com.hookledger.gateway.http;

import com.hookledger.ingest.IngestionPipeline;
import com.hookledger.shared.config.HookLedgerConfig;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class WebhookController {

    private final IngestionPipeline pipeline;
    private final String signatureHeader;

    public WebhookController(IngestionPipeline pipeline, HookLedgerConfig config) {
        this.pipeline = pipeline;
        this.signatureHeader = config.ingest().signatureHeader();
    }

    /**
     * Takes the body as raw bytes: the signature covers exactly what was sent.
     */
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> receive(@RequestBody(required = false) byte[] body,
                                                       HttpServletRequest request) {
        var outcome = pipeline.ingest(body == null ? new byte[0] : body, request.getHeader(signatureHeader));
        return switch (outcome.result()) {
            case CREATED, DUPLICATE -> ResponseEntity.ok(Map.of("status", "ok"));
            case INVALID_SIGNATURE -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("detail", "invalid signature"));
            case VALIDATION_ERROR -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("detail", List.of(Map.of(
                    "field", outcome.error().field(),
                    "reason", outcome.error().reason()))));
            case STORAGE_UNAVAILABLE, STORAGE_ERROR -> throw new IllegalStateException("storage failure must surface as an exception");
        };
    }
}
