package com.hookledger.ingest;

public record IngestionOutcome(WebhookResult result, String messageId, ValidationError error) {

    static IngestionOutcome of(WebhookResult result, String messageId) {
        return new IngestionOutcome(result, messageId, null);
    }

    static IngestionOutcome rejected(ValidationError error, String messageId) {
        return new IngestionOutcome(WebhookResult.VALIDATION_ERROR, messageId, error);
    }
}
