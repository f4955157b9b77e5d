package com.marketpulse.dispatch.api;

import com.marketpulse.core.health.HealthCheckService;
import com.marketpulse.core.health.HealthStatus;
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
    @DisplayName("a degraded provider category keeps the service at 200")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("checkpoints", HealthStatus.Status.UP, "in memory", Map.of()),
                new HealthStatus("ai-providers", HealthStatus.Status.DEGRADED, "1/2 provider(s) available", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.ai-providers.detail").value("1/2 provider(s) available"));
    }

    @Test
    @DisplayName("any DOWN component yields 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("checkpoints", HealthStatus.Status.DOWN, "Database connection invalid", Map.of()),
                new HealthStatus("ai-providers", HealthStatus.Status.DEGRADED, null, Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("checkpoints", HealthStatus.Status.UP, "ok", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
