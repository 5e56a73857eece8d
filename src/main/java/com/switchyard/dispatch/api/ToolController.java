package com.switchyard.dispatch.api;

import com.switchyard.core.classifier.ToolClassifier;
import com.switchyard.core.executor.LocalToolRegistry;
import com.switchyard.core.model.ExecutionOutcome;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.router.ExecutionRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for tool invocation and the tool catalogue.
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ToolController {

    private static final Logger log = LoggerFactory.getLogger(ToolController.class);

    private final ExecutionRouter router;
    private final ToolClassifier classifier;
    private final LocalToolRegistry localTools;

    public ToolController(ExecutionRouter router, ToolClassifier classifier, LocalToolRegistry localTools) {
        this.router = router;
        this.classifier = classifier;
        this.localTools = localTools;
    }

    /**
     * POST /api/v1/tools/{tool}/invocations: Execute a tool.
     * Returns 200 with the result, or 202 with a job id when the call was deferred.
     */
    @PostMapping("/{tool}/invocations")
    public ResponseEntity<?> invoke(@PathVariable String tool,
                                    @RequestBody(required = false) InvocationBody body) {
        Map<String, Object> parameters = body == null || body.parameters() == null ? Map.of() : body.parameters();
        try {
            ExecutionOutcome outcome = router.execute(tool, parameters);
            var response = InvocationResponse.from(tool, outcome);
            return outcome.isDeferred()
                    ? ResponseEntity.status(HttpStatus.ACCEPTED).body(response)
                    : ResponseEntity.ok(response);
        } catch (RouterException e) {
            log.info("Invocation of {} rejected ({}): {}", tool, e.kind(), e.getMessage());
            return ApiErrors.of(e);
        }
    }

    /**
     * GET /api/v1/tools: Registered tools with their tier policy.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list() {
        List<Map<String, Object>> tools = classifier.all().stream()
                .map(this::describe)
                .toList();
        return ResponseEntity.ok(tools);
    }

    private Map<String, Object> describe(ToolDescriptor d) {
        var m = new LinkedHashMap<String, Object>();
        m.put("name", d.name());
        m.put("tier", d.tier().key());
        m.put("cache_ttl_seconds", d.cacheTtl().toSeconds());
        m.put("local_timeout_ms", d.hasLocalTimeout() ? d.localTimeout().toMillis() : null);
        m.put("priority", d.priority());
        m.put("local", localTools.contains(d.name()));
        return m;
    }
}
