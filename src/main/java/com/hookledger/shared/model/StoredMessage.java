package com.hookledger.shared.model;

import java.time.Instant;

public record StoredMessage(
    String messageId,
    String from,
    String to,
    Instant ts,
    String text,
    Instant createdAt
) {}
