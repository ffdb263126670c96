package com.lodestar.core.emission;

/**
 * Thrown when values supplied to {@link EmissionSpec#build} do not match the
 * declared emissions: an undeclared key, a missing required key, or a value
 * of an unsupported type.
 */
public class EmissionException extends RuntimeException {

    private final String key;

    public EmissionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public EmissionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** Fully-qualified key the problem concerns. */
    public String key() {
        return key;
    }
}
