package com.hookledger.store;

import com.hookledger.shared.model.StoredMessage;

import java.util.List;

/**
 * One page of a listing; {@code total} counts every match, not just this page.
 */
public record MessagePage(List<StoredMessage> items, long total) {}
