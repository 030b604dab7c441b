package com.hookledger.store;

public record SenderCount(String from, long count) {}
