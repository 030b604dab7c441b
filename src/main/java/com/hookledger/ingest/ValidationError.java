package com.hookledger.ingest;

public record ValidationError(String field, String reason) {}
