package com.lodestar.core.persistence;

/**
 * Thrown when a {@link StateStore} cannot read or write session state.
 * Wraps the underlying I/O or SQL failure.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
