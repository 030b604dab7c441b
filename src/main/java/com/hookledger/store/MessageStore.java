package com.hookledger.store;

import com.hookledger.shared.model.InboundMessage;

public interface MessageStore {

    int MIN_LIMIT = 1;
    int MAX_LIMIT = 100;
    int DEFAULT_LIMIT = 50;

    /**
     * Writes the message unless its id is already stored. An existing row is never modified.
     *
     * @throws StorageUnavailableException when the database fails or times out
     */
    InsertResult insert(InboundMessage message);

    /**
     * Messages ordered by (ts, message_id) ascending.
     *
     * @throws IllegalArgumentException if limit is outside [1, 100] or offset is negative
     */
    MessagePage list(MessageFilter filter, int limit, int offset);

    MessageStats stats();

    boolean ping();
}
