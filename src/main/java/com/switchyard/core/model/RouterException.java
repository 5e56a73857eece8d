package com.switchyard.core.model;

/**
 * Base class for all routing failures. Carries the {@link ErrorKind} so
 * callers can branch on the category without inspecting messages.
 */
public class RouterException extends RuntimeException {

    private final ErrorKind kind;

    public RouterException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RouterException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
