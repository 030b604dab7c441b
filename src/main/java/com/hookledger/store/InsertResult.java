package com.hookledger.store;

public enum InsertResult {
    CREATED,
    ALREADY_EXISTS
}
