package com.switchyard.dispatch.api;

import com.switchyard.core.router.ExecutionRouter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for explicit cache invalidation.
 */
@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final ExecutionRouter router;

    public CacheController(ExecutionRouter router) {
        this.router = router;
    }

    @DeleteMapping("/{fingerprint}")
    public ResponseEntity<Void> invalidate(@PathVariable String fingerprint) {
        return router.invalidate(fingerprint)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
