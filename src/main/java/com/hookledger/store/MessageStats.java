package com.hookledger.store;

import java.time.Instant;
import java.util.List;

public record MessageStats(
    long totalMessages,
    long sendersCount,
    List<SenderCount> topSenders,
    Instant firstMessageTs,
    Instant lastMessageTs
) {}
