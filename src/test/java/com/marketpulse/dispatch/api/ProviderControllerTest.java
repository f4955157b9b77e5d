package com.marketpulse.dispatch.api;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import com.marketpulse.core.provider.ProviderHealthRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProviderController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ProviderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProviderHealthRegistry registry;

    @Test
    @DisplayName("GET lists provider health records")
    void list() throws Exception {
        when(registry.snapshot()).thenReturn(List.of(
                new ProviderRecord("brave", ProviderCategory.RESEARCH, 0, null, null, true),
                new ProviderRecord("gemini", ProviderCategory.AI, 3, Instant.parse("2026-03-01T10:05:00Z"),
                        "429 Too Many Requests", false)));

        mockMvc.perform(get("/api/v1/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].name").value("gemini"))
                .andExpect(jsonPath("$[1].available").value(false))
                .andExpect(jsonPath("$[1].consecutiveFailures").value(3));
    }

    @Test
    @DisplayName("POST reset without a provider resets the whole category")
    void resetCategory() throws Exception {
        when(registry.reset(ProviderCategory.AI, "all")).thenReturn(3);

        mockMvc.perform(post("/api/v1/providers/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\": \"ai\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("ai"))
                .andExpect(jsonPath("$.provider").value("all"))
                .andExpect(jsonPath("$.reset").value(3));
    }

    @Test
    void resetSingleProvider() throws Exception {
        when(registry.reset(ProviderCategory.RESEARCH, "brave")).thenReturn(1);

        mockMvc.perform(post("/api/v1/providers/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\": \"research\", \"provider\": \"brave\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(1));
    }

    @Test
    void unknownCategory() throws Exception {
        mockMvc.perform(post("/api/v1/providers/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\": \"crm\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown category: crm"));
        verify(registry, never()).reset(any(), anyString());
    }

    @Test
    void missingCategory() throws Exception {
        mockMvc.perform(post("/api/v1/providers/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("category is required"));
    }
}
