package com.hookledger.observability;

import com.hookledger.shared.config.HookLedgerConfig;
import com.hookledger.store.MessageStore;

import java.util.Optional;

/**
 * Decides whether the process should receive traffic: the signing secret
 * must be configured and the message store must answer.
 */
public class ReadinessProbe {

    private final HookLedgerConfig config;
    private final MessageStore store;

    public ReadinessProbe(HookLedgerConfig config, MessageStore store) {
        this.config = config;
        this.store = store;
    }

    /**
     * Reason the process is not ready, empty when it is.
     */
    public Optional<String> check() {
        var configProblem = config.validate();
        if (configProblem.isPresent()) {
            return configProblem;
        }
        if (!store.ping()) {
            return Optional.of("database not ready");
        }
        return Optional.empty();
    }
}
