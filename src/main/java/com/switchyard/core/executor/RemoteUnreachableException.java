package com.switchyard.core.executor;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

/**
 * The remote backend could not be reached at all (connection refused, DNS,
 * network timeout). Distinct from {@link ToolExecutionException} so callers can
 * defer the request without counting it as a tool failure.
 */
public class RemoteUnreachableException extends RouterException {

    public RemoteUnreachableException(String message, Throwable cause) {
        super(ErrorKind.REMOTE_UNREACHABLE, message, cause);
    }
}
