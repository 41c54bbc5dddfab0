package com.cloud.emulator.state;

/**
 * Runtime exception thrown when a state store operation fails.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
