package com.switchyard.core.queue;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;

public class JobNotFoundException extends RouterException {

    public JobNotFoundException(String jobId) {
        super(ErrorKind.JOB_NOT_FOUND, "Job not found: " + jobId);
    }
}
