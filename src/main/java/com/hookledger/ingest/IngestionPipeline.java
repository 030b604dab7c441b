package com.hookledger.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookledger.observability.MetricsRegistry;
import com.hookledger.security.SignatureVerifier;
import com.hookledger.store.InsertResult;
import com.hookledger.store.MessageRejectedException;
import com.hookledger.store.MessageStore;
import com.hookledger.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;

/**
 * Handles one inbound webhook: signature, then payload, then storage, then
 * exactly one webhook result metric. The first failing stage ends the request.
 * Nothing from the body is parsed before the signature has been checked.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final SignatureVerifier verifier;
    private final PayloadValidator validator;
    private final MessageStore store;
    private final MetricsRegistry metrics;
    private final byte[] secret;

    public IngestionPipeline(SignatureVerifier verifier, PayloadValidator validator,
                             MessageStore store, MetricsRegistry metrics, byte[] secret) {
        this.verifier = verifier;
        this.validator = validator;
        this.store = store;
        this.metrics = metrics;
        this.secret = secret.clone();
    }

    public IngestionOutcome ingest(byte[] rawBody, String signatureHex) {
        if (!verifier.verify(rawBody, signatureHex, secret)) {
            return finish(IngestionOutcome.of(WebhookResult.INVALID_SIGNATURE, null));
        }

        JsonNode body;
        try {
            body = MAPPER.readTree(rawBody);
        } catch (JsonProcessingException e) {
            return finish(IngestionOutcome.rejected(new ValidationError("body", "malformed JSON"), null));
        } catch (IOException e) {
            return finish(IngestionOutcome.rejected(new ValidationError("body", "unreadable body"), null));
        }

        var validation = validator.validate(body);
        if (!validation.isValid()) {
            return finish(IngestionOutcome.rejected(validation.error(), messageIdOf(body)));
        }

        var message = validation.message();
        InsertResult inserted;
        try {
            inserted = store.insert(message);
        } catch (MessageRejectedException e) {
            log.warn("Database refused message {}: {}", message.messageId(), e.getCause().getMessage());
            return finish(IngestionOutcome.rejected(
                new ValidationError("body", "value not accepted for storage"), message.messageId()));
        } catch (StorageUnavailableException e) {
            finish(IngestionOutcome.of(WebhookResult.STORAGE_UNAVAILABLE, message.messageId()));
            throw e;
        } catch (RuntimeException e) {
            finish(IngestionOutcome.of(WebhookResult.STORAGE_ERROR, message.messageId()));
            throw e;
        }

        var result = inserted == InsertResult.CREATED ? WebhookResult.CREATED : WebhookResult.DUPLICATE;
        return finish(IngestionOutcome.of(result, message.messageId()));
    }

    private IngestionOutcome finish(IngestionOutcome outcome) {
        metrics.recordWebhookResult(outcome.result());

        try (var ignoredId = MDC.putCloseable("message_id", outcome.messageId());
             var ignoredDup = MDC.putCloseable("dup", String.valueOf(outcome.result() == WebhookResult.DUPLICATE));
             var ignoredResult = MDC.putCloseable("result", outcome.result().label())) {
            if (outcome.result() == WebhookResult.STORAGE_UNAVAILABLE || outcome.result() == WebhookResult.STORAGE_ERROR) {
                log.error("Webhook storage failed");
            } else if (outcome.error() != null) {
                log.info("Webhook rejected: {} {}", outcome.error().field(), outcome.error().reason());
            } else {
                log.info("Webhook {}", outcome.result().label());
            }
        }
        return outcome;
    }

    private static String messageIdOf(JsonNode body) {
        if (body == null || !body.isObject()) return null;
        var id = body.get("message_id");
        return id != null && id.isTextual() ? id.asText() : null;
    }
}
