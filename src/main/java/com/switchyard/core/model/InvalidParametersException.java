package com.switchyard.core.model;

/**
 * Thrown when a request's parameters cannot be canonicalised or fail validation.
 */
public class InvalidParametersException extends RouterException {

    public InvalidParametersException(String message) {
        super(ErrorKind.INVALID_PARAMETERS, message);
    }

    public InvalidParametersException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PARAMETERS, message, cause);
    }
}
