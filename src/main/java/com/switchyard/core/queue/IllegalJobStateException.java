package com.switchyard.core.queue;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

/**
 * An operator action that the job's current status does not allow,
 * e.g. retrying a job that has not failed.
 */
public class IllegalJobStateException extends RouterException {

    public IllegalJobStateException(String message) {
        super(ErrorKind.ILLEGAL_JOB_STATE, message);
    }
}
