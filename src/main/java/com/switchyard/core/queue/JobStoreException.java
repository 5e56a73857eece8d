package com.switchyard.core.queue;

/**
 * The durable job store could not be read or written.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
