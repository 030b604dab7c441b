package com.hookledger.store;

/**
 * The database refused a value in the message itself. Retrying the same
 * payload fails the same way.
 */
public class MessageRejectedException extends RuntimeException {

    public MessageRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
