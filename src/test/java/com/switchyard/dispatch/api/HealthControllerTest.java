package com.switchyard.dispatch.api;

import com.switchyard.core.health.HealthCheckService;
import com.switchyard.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("degraded components still answer 200")
    void degradedIsOk() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("jobStore", HealthStatus.Status.UP, "Job store readable", Map.of("queued", "0")),
                new HealthStatus("connectivity", HealthStatus.Status.DEGRADED, "Offline", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.jobStore.status").value("UP"))
                .andExpect(jsonPath("$.components.jobStore.metadata.queued").value("0"))
                .andExpect(jsonPath("$.components.connectivity.detail").value("Offline"));
    }

    @Test
    @DisplayName("a DOWN component answers 503")
    void downIsUnavailable() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("localTools", HealthStatus.Status.DOWN, "missing count_words", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
