package com.switchyard.dispatch.api;

import com.switchyard.core.connectivity.ConnectivityMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for reading and overriding the connectivity state.
 */
@RestController
@RequestMapping("/api/v1/connectivity")
public class ConnectivityController {

    private final ConnectivityMonitor connectivity;

    public ConnectivityController(ConnectivityMonitor connectivity) {
        this.connectivity = connectivity;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> get() {
        return ResponseEntity.ok(Map.of("online", connectivity.isOnline()));
    }

    /**
     * PUT /api/v1/connectivity: {@code {"online": true|false}}. Going online triggers a drain.
     */
    @PutMapping
    public ResponseEntity<?> set(@RequestBody Map<String, Object> body) {
        Object online = body == null ? null : body.get("online");
        if (!(online instanceof Boolean value)) {
            return ApiErrors.badRequest("Body must contain boolean field 'online'");
        }
        boolean changed = connectivity.setOnline(value);
        return ResponseEntity.ok(Map.of("online", connectivity.isOnline(), "changed", changed));
    }
}
