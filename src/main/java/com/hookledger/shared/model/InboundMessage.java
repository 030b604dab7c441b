package com.hookledger.shared.model;

import java.time.Instant;

/**
 * A webhook message that passed validation. {@code text} may be null.
 */
public record InboundMessage(
    String messageId,
    String from,
    String to,
    Instant ts,
    String text
) {}
