package com.switchyard.core.model;

/**
 * Failure taxonomy for tool invocation. Only {@link #UNKNOWN_TOOL},
 * {@link #INVALID_PARAMETERS} and {@link #QUEUE_FULL} ever reach the
 * caller of an execution; the rest are absorbed by fallback or queueing.
 */
public enum ErrorKind {
    UNKNOWN_TOOL,
    INVALID_PARAMETERS,
    LOCAL_TIMEOUT,
    LOCAL_EXECUTION_FAILED,
    REMOTE_UNREACHABLE,
    REMOTE_EXECUTION_FAILED,
    QUEUE_EXHAUSTED,
    QUEUE_FULL,
    JOB_NOT_FOUND,
    ILLEGAL_JOB_STATE
}
