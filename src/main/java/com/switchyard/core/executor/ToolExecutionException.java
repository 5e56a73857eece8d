package com.switchyard.core.executor;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

/**
 * A tool invocation that ran (or was attempted) and did not produce a result.
 * The {@link ErrorKind} tells the router whether the failure was a timeout,
 * a local error or an application-level error reported by the remote backend.
 */
public class ToolExecutionException extends RouterException {

    public ToolExecutionException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public ToolExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
