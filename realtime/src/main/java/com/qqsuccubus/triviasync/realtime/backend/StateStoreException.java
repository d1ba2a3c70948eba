package com.qqsuccubus.triviasync.realtime.backend;

/**
 * Failure reading or writing the authoritative game state.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
