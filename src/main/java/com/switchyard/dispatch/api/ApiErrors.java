package com.switchyard.dispatch.api;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;

/**
 * Maps router errors to HTTP responses with a {@code {"error": ..., "kind": ...}} body.
 */
final class ApiErrors {

    private ApiErrors() {}

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case UNKNOWN_TOOL, JOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_PARAMETERS -> HttpStatus.BAD_REQUEST;
            case QUEUE_FULL -> HttpStatus.SERVICE_UNAVAILABLE;
            case ILLEGAL_JOB_STATE -> HttpStatus.CONFLICT;
            case LOCAL_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case LOCAL_EXECUTION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case REMOTE_UNREACHABLE, REMOTE_EXECUTION_FAILED, QUEUE_EXHAUSTED -> HttpStatus.BAD_GATEWAY;
        };
    }

    static ResponseEntity<Object> of(RouterException e) {
        return respond(statusFor(e.kind()), e.getMessage(), e.kind());
    }

    static ResponseEntity<Object> badRequest(String message) {
        return respond(HttpStatus.BAD_REQUEST, message, ErrorKind.INVALID_PARAMETERS);
    }

    private static ResponseEntity<Object> respond(HttpStatus status, String message, ErrorKind kind) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", message);
        body.put("kind", kind.name());
        return ResponseEntity.status(status).body(body);
    }
}
