package com.hookledger.store;

/**
 * The message database could not be reached or did not answer in time.
 * Callers should treat it as retryable.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
