package com.hookledger.shared.config;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

public record HookLedgerConfig(
    int serverPort,
    String webhookSecret,
    String logLevel,
    DatabaseConfig database,
    IngestConfig ingest
) {

    public boolean hasSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    public byte[] secretBytes() {
        return hasSecret() ? webhookSecret.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    /**
     * First critical setting that is missing, empty when the process can serve traffic.
     */
    public Optional<String> validate() {
        if (!hasSecret()) {
            return Optional.of("WEBHOOK_SECRET environment variable is not set");
        }
        if (database.url() == null || database.url().isBlank()) {
            return Optional.of("DATABASE_URL environment variable is not set");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "HookLedgerConfig[serverPort=" + serverPort
            + ", webhookSecret=" + (hasSecret() ? "***" : "<unset>")
            + ", logLevel=" + logLevel
            + ", database=" + database
            + ", ingest=" + ingest + "]";
    }
}
