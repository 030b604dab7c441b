package com.hookledger.ingest;

import com.hookledger.shared.model.InboundMessage;

/**
 * Either a validated message or the first field that failed.
 */
public record ValidationResult(InboundMessage message, ValidationError error) {

    public static ValidationResult valid(InboundMessage message) {
        return new ValidationResult(message, null);
    }

    public static ValidationResult invalid(String field, String reason) {
        return new ValidationResult(null, new ValidationError(field, reason));
    }

    public boolean isValid() {
        return error == null;
    }
}
