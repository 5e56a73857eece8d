package com.switchyard.dispatch.api;

import com.switchyard.core.classifier.ToolClassifier;
import com.switchyard.core.classifier.UnknownToolException;
import com.switchyard.core.executor.LocalToolRegistry;
import com.switchyard.core.executor.ToolExecutionException;
import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.ExecutionOutcome;
import com.switchyard.core.model.Route;
import com.switchyard.core.model.Tier;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.queue.QueueFullException;
import com.switchyard.core.router.ExecutionRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ToolController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExecutionRouter router;

    @MockitoBean
    private ToolClassifier classifier;

    @MockitoBean
    private LocalToolRegistry localTools;

    private static final String BODY = "{\"parameters\":{\"text\":\"hello world\"}}";

    // ── POST /api/v1/tools/{tool}/invocations ────────────────────────

    @Test
    @DisplayName("completed invocation returns 200 with result and route")
    void completedInvocation() throws Exception {
        when(router.execute(eq("calculate_reading_time"), anyMap()))
                .thenReturn(ExecutionOutcome.completed(Map.of("reading_time_minutes", 1), Route.LOCAL, 3));

        mockMvc.perform(post("/api/v1/tools/calculate_reading_time/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.route").value("local"))
                .andExpect(jsonPath("$.result.reading_time_minutes").value(1))
                .andExpect(jsonPath("$.latency_ms").value(3))
                .andExpect(jsonPath("$.job_id").doesNotExist());
    }

    @Test
    @DisplayName("cache hit reports the cache route and store time")
    void cachedInvocation() throws Exception {
        when(router.execute(eq("count_words"), anyMap()))
                .thenReturn(ExecutionOutcome.cached(Map.of("total_words", 2), Instant.parse("2026-07-01T10:00:00Z")));

        mockMvc.perform(post("/api/v1/tools/count_words/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.route").value("cache"))
                .andExpect(jsonPath("$.cached_at").value("2026-07-01T10:00:00Z"));
    }

    @Test
    @DisplayName("deferred invocation returns 202 with the job id")
    void deferredInvocation() throws Exception {
        when(router.execute(eq("build_graph"), anyMap()))
                .thenReturn(ExecutionOutcome.deferred("job-42", 1));

        mockMvc.perform(post("/api/v1/tools/build_graph/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("deferred"))
                .andExpect(jsonPath("$.route").value("queue"))
                .andExpect(jsonPath("$.job_id").value("job-42"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    @DisplayName("missing body executes with empty parameters")
    void missingBody() throws Exception {
        when(router.execute(eq("count_words"), eq(Map.of())))
                .thenThrow(new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED, "Missing required parameter 'text'"));

        mockMvc.perform(post("/api/v1/tools/count_words/invocations"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("LOCAL_EXECUTION_FAILED"))
                .andExpect(jsonPath("$.error", containsString("text")));
    }

    @Test
    @DisplayName("unknown tool returns 404")
    void unknownTool() throws Exception {
        when(router.execute(eq("nope"), anyMap())).thenThrow(new UnknownToolException("nope"));

        mockMvc.perform(post("/api/v1/tools/nope/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_TOOL"));
    }

    @Test
    @DisplayName("full queue returns 503")
    void queueFull() throws Exception {
        when(router.execute(eq("build_graph"), anyMap())).thenThrow(new QueueFullException(1000));

        mockMvc.perform(post("/api/v1/tools/build_graph/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("QUEUE_FULL"));
    }

    @Test
    @DisplayName("local timeout on a simple tool returns 504")
    void localTimeout() throws Exception {
        when(router.execute(eq("count_words"), anyMap()))
                .thenThrow(new ToolExecutionException(ErrorKind.LOCAL_TIMEOUT, "exceeded 30000ms"));

        mockMvc.perform(post("/api/v1/tools/count_words/invocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isGatewayTimeout());
    }

    // ── GET /api/v1/tools ────────────────────────────────────────────

    @Test
    @DisplayName("GET /tools lists descriptors with local availability")
    void listTools() throws Exception {
        when(classifier.all()).thenReturn(List.of(
                new ToolDescriptor("count_words", Tier.SIMPLE, null, Duration.ofHours(1), 10),
                new ToolDescriptor("extract_keywords", Tier.MEDIUM, Duration.ofSeconds(2), Duration.ofMinutes(30), 5)));
        when(localTools.contains("count_words")).thenReturn(true);

        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("count_words"))
                .andExpect(jsonPath("$[0].tier").value("simple"))
                .andExpect(jsonPath("$[0].local").value(true))
                .andExpect(jsonPath("$[0].cache_ttl_seconds").value(3600))
                .andExpect(jsonPath("$[1].local_timeout_ms").value(2000))
                .andExpect(jsonPath("$[1].local").value(false));
    }
}
