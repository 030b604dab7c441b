package com.hookledger.shared.config;

import java.util.List;

public record IngestConfig(
    String signatureHeader,
    int maxTextLength,
    List<Long> latencyBucketsMs
) {
    /** Width of the stored text column. */
    public static final int MAX_TEXT_LENGTH = 4096;

    public static IngestConfig defaults() {
        return new IngestConfig("X-Signature", MAX_TEXT_LENGTH, List.of(10L, 50L, 100L, 500L, 1000L, 5000L));
    }
}
