package com.hookledger.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.hookledger.shared.config.IngestConfig;
import com.hookledger.shared.model.InboundMessage;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Checks the shape of a webhook body. Reports the first offending field,
 * in the order message_id, from, to, ts, text.
 */
public class PayloadValidator {

    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{7,15}$");
    private static final int MAX_MESSAGE_ID_LENGTH = 255;
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;
    private static final Instant EARLIEST = LocalDate.of(MIN_YEAR, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
    private static final Instant END = LocalDate.of(MAX_YEAR + 1, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
    private static final String NUL_REASON = "must not contain NUL characters";

    private final int maxTextLength;

    public PayloadValidator(int maxTextLength) {
        if (maxTextLength < 0 || maxTextLength > IngestConfig.MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("maxTextLength must be between 0 and " + IngestConfig.MAX_TEXT_LENGTH);
        }
        this.maxTextLength = maxTextLength;
    }

    public ValidationResult validate(JsonNode body) {
        if (body == null || !body.isObject()) {
            return ValidationResult.invalid("body", "must be a JSON object");
        }

        var messageId = body.get("message_id");
        if (messageId == null || messageId.isNull()) {
            return ValidationResult.invalid("message_id", "field required");
        }
        if (!messageId.isTextual() || messageId.asText().isBlank()) {
            return ValidationResult.invalid("message_id", "must be a non-empty string");
        }
        if (messageId.asText().length() > MAX_MESSAGE_ID_LENGTH) {
            return ValidationResult.invalid("message_id", "must be at most " + MAX_MESSAGE_ID_LENGTH + " characters");
        }
        if (hasNul(messageId.asText())) {
            return ValidationResult.invalid("message_id", NUL_REASON);
        }

        for (var field : new String[]{"from", "to"}) {
            var error = checkPhone(field, body.get(field));
            if (error != null) return ValidationResult.invalid(field, error);
        }

        var ts = body.get("ts");
        if (ts == null || ts.isNull()) {
            return ValidationResult.invalid("ts", "field required");
        }
        if (!ts.isTextual()) {
            return ValidationResult.invalid("ts", "must be a string");
        }
        OffsetDateTime parsed;
        try {
            parsed = OffsetDateTime.parse(ts.asText(), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            return ValidationResult.invalid("ts", "must be ISO-8601 with a timezone designator (Z or +hh:mm)");
        }
        var instant = parsed.toInstant();
        if (instant.isBefore(EARLIEST) || !instant.isBefore(END)) {
            return ValidationResult.invalid("ts", "year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }

        String text = null;
        var textNode = body.get("text");
        if (textNode != null && !textNode.isNull()) {
            if (!textNode.isTextual()) {
                return ValidationResult.invalid("text", "must be a string");
            }
            text = textNode.asText();
            if (text.length() > maxTextLength) {
                return ValidationResult.invalid("text", "must be at most " + maxTextLength + " characters");
            }
            if (hasNul(text)) {
                return ValidationResult.invalid("text", NUL_REASON);
            }
        }

        return ValidationResult.valid(new InboundMessage(
            messageId.asText(),
            body.get("from").asText(),
            body.get("to").asText(),
            instant.truncatedTo(ChronoUnit.MICROS),
            text));
    }

    private static boolean hasNul(String value) {
        return value.indexOf('\0') >= 0;
    }

    private static String checkPhone(String field, JsonNode node) {
        if (node == null || node.isNull()) return "field required";
        if (!node.isTextual()) return "must be a string";
        if (!PHONE.matcher(node.asText()).matches()) {
            return "must be a phone number: optional leading + then 7 to 15 digits";
        }
        return null;
    }
}
