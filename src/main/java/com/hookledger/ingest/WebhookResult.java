package com.hookledger.ingest;

public enum WebhookResult {
    CREATED("created"),
    DUPLICATE("duplicate"),
    INVALID_SIGNATURE("invalid_signature"),
    VALIDATION_ERROR("validation_error"),
    STORAGE_UNAVAILABLE("storage_unavailable"),
    STORAGE_ERROR("storage_error");

    private final String label;

    WebhookResult(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean accepted() {
        return this == CREATED || this == DUPLICATE;
    }
}
