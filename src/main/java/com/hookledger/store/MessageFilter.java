package com.hookledger.store;

import java.time.Instant;

/**
 * Optional list filters; null means "no constraint".
 */
public record MessageFilter(String from, Instant since, String textQuery) {

    public static MessageFilter none() {
        return new MessageFilter(null, null, null);
    }
}
