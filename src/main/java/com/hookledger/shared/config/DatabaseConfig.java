package com.hookledger.shared.config;

public record DatabaseConfig(
    String url,
    String username,
    String password,
    int poolSize,
    long connectionTimeoutMs,
    int queryTimeoutSeconds
) {
    public static DatabaseConfig defaults() {
        return new DatabaseConfig("jdbc:postgresql://localhost:5432/hookledger",
            "hookledger", "hookledger", 10, 5_000, 5);
    }

    @Override
    public String toString() {
        return "DatabaseConfig[url=" + url + ", username=" + username
            + ", poolSize=" + poolSize + ", connectionTimeoutMs=" + connectionTimeoutMs
            + ", queryTimeoutSeconds=" + queryTimeoutSeconds + "]";
    }
}
