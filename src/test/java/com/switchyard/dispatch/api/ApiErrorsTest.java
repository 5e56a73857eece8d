package com.switchyard.dispatch.api;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.RouterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorsTest {

    @Test
    @DisplayName("error body carries the message and kind")
    void errorBody() {
        ResponseEntity<Object> response = ApiErrors.of(new RouterException(ErrorKind.JOB_NOT_FOUND, "no job j-1"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(Map.of("error", "no job j-1", "kind", "JOB_NOT_FOUND"), response.getBody());
    }

    @Test
    @DisplayName("bad request reports invalid parameters")
    void badRequest() {
        ResponseEntity<Object> response = ApiErrors.badRequest("Unknown format: xml");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("error", "Unknown format: xml", "kind", "INVALID_PARAMETERS"), response.getBody());
    }

    @Test
    @DisplayName("every kind maps to a client or gateway error")
    void everyKindMapped() {
        for (ErrorKind kind : ErrorKind.values()) {
            HttpStatus status = ApiErrors.statusFor(kind);
            assertTrue(status.is4xxClientError() || status.is5xxServerError(), kind + " -> " + status);
        }
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, ApiErrors.statusFor(ErrorKind.LOCAL_TIMEOUT));
        assertEquals(HttpStatus.CONFLICT, ApiErrors.statusFor(ErrorKind.ILLEGAL_JOB_STATE));
    }
}
