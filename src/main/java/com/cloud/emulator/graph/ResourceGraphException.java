package com.cloud.emulator.graph;

import java.util.Objects;

/**
 * Base runtime exception for relationship bookkeeping failures.
 * Every failure carries an {@link ErrorKind} so callers can build a
 * provider-faithful response without inspecting the concrete type.
 */
public class ResourceGraphException extends RuntimeException {

    private final ErrorKind kind;

    public ResourceGraphException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ResourceGraphException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind kind() {
        return kind;
    }
}
