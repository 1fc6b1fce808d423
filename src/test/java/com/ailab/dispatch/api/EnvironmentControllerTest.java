package com.ailab.dispatch.api;

import com.ailab.core.error.AccessDeniedException;
import com.ailab.core.error.EnvironmentNotFoundException;
import com.ailab.core.error.InvalidStateException;
import com.ailab.core.error.PortsExhaustedException;
import com.ailab.core.error.QuotaExceededException;
import com.ailab.core.lifecycle.CreateEnvironmentRequest;
import com.ailab.core.lifecycle.LifecycleManager;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import com.ailab.core.model.EnvironmentStatus;
import com.ailab.core.model.PortMapping;
import com.ailab.core.model.ResourceLimits;
import com.ailab.core.quota.QuotaDenialReason;
import com.ailab.core.security.CallerResolver;
import com.ailab.runtime.RuntimeTimeoutException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
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
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EnvironmentController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EnvironmentControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private LifecycleManager lifecycleManager;

    @MockitoBean
    private CallerResolver callerResolver;

    @MockitoBean
    private ApiProperties apiProperties;

    private final Caller alice = Caller.user("alice");

    @BeforeEach
    void setUp() {
        when(callerResolver.resolve("alice")).thenReturn(alice);
        when(callerResolver.resolve(null)).thenThrow(new AccessDeniedException("No authenticated user on request"));
        when(apiProperties.getPublicHost()).thenReturn("lab.example.org");
    }

    private static Environment running(String id) {
        return new Environment(id, "alice", "pytorch-jupyter", EnvironmentStatus.RUNNING,
                List.of(new PortMapping(8888, 8800)), Set.of(0), new ResourceLimits(4.0, 16384),
                "c-123", null, T0, T0.plusSeconds(3), null);
    }

    // ── POST /api/v1/environments ─────────────────────────────────────

    @Test
    @DisplayName("POST /environments returns 201 with the running environment and its access URL")
    void create() throws Exception {
        when(lifecycleManager.create(eq("alice"), any(CreateEnvironmentRequest.class)))
                .thenReturn(running("ai-lab-env-pytorch-jupyter-1a2b3c4d"));

        String body = objectMapper.writeValueAsString(
                new CreateEnvironmentRequest("pytorch-jupyter", 1, null, null, Map.of()));

        mockMvc.perform(post("/api/v1/environments")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("ai-lab-env-pytorch-jupyter-1a2b3c4d"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.ports[0].hostPort").value(8800))
                .andExpect(jsonPath("$.accessUrl").value("http://lab.example.org:8800"))
                .andExpect(jsonPath("$.createdAt").value("2026-03-01T09:00:00Z"))
                .andExpect(jsonPath("$.runtimeHandle").doesNotExist());
    }

    @Test
    @DisplayName("POST /environments without a template is a 400")
    void createValidation() throws Exception {
        mockMvc.perform(post("/api/v1/environments")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gpus\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"))
                .andExpect(jsonPath("$.message", containsString("templateId")));

        verifyNoInteractions(lifecycleManager);
    }

    @Test
    @DisplayName("Quota denial is a 403 carrying the specific reason")
    void quotaDenied() throws Exception {
        when(lifecycleManager.create(eq("alice"), any(CreateEnvironmentRequest.class)))
                .thenThrow(new QuotaExceededException(QuotaDenialReason.GPU_QUOTA_EXCEEDED, "GPU quota exceeded"));

        mockMvc.perform(post("/api/v1/environments")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": \"multi-gpu\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("quota_exceeded"))
                .andExpect(jsonPath("$.reason").value("gpu_quota_exceeded"));
    }

    @Test
    @DisplayName("Exhausted port range is a 409")
    void portsExhausted() throws Exception {
        when(lifecycleManager.create(eq("alice"), any(CreateEnvironmentRequest.class)))
                .thenThrow(new PortsExhaustedException("Host port range 8800-8999 has 0 free ports, 1 needed"));

        mockMvc.perform(post("/api/v1/environments")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": \"vscode\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ports_exhausted"));
    }

    @Test
    @DisplayName("A runtime timeout is a 504")
    void runtimeTimeout() throws Exception {
        when(lifecycleManager.create(eq("alice"), any(CreateEnvironmentRequest.class)))
                .thenThrow(new RuntimeTimeoutException("Runtime start did not complete within 60s"));

        mockMvc.perform(post("/api/v1/environments")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"templateId\": \"vscode\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("runtime_timeout"));
    }

    // ── GET ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /environments lists only the caller's environments")
    void list() throws Exception {
        when(lifecycleManager.listForUser("alice")).thenReturn(List.of(running("env-1"), running("env-2")));

        mockMvc.perform(get("/api/v1/environments").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].ownerId", everyItem(is("alice"))));
    }

    @Test
    @DisplayName("Requests without a user are a 403")
    void noUser() throws Exception {
        mockMvc.perform(get("/api/v1/environments"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access_denied"));
    }

    @Test
    @DisplayName("GET /environments/{id} of someone else's environment is a 403")
    void getForeign() throws Exception {
        when(lifecycleManager.get("env-bob", alice))
                .thenThrow(new AccessDeniedException("alice may not get env-bob"));

        mockMvc.perform(get("/api/v1/environments/env-bob").header("X-User-Id", "alice"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("GET /environments/{id} of an unknown id is a 404")
    void getUnknown() throws Exception {
        when(lifecycleManager.get("nope", alice)).thenThrow(new EnvironmentNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/environments/nope").header("X-User-Id", "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    // ── stop / start / destroy ────────────────────────────────────────

    @Test
    @DisplayName("POST /environments/{id}/stop returns the stopped environment without an access URL")
    void stop() throws Exception {
        when(lifecycleManager.stop("env-1", alice)).thenReturn(running("env-1").stopped(T0.plusSeconds(60)));

        mockMvc.perform(post("/api/v1/environments/env-1/stop").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("stopped"))
                .andExpect(jsonPath("$.accessUrl").value(nullValue()));
    }

    @Test
    @DisplayName("POST /environments/{id}/start of a running environment is a 409")
    void startRunning() throws Exception {
        when(lifecycleManager.start("env-1", alice))
                .thenThrow(new InvalidStateException("env-1", EnvironmentStatus.RUNNING, "start"));

        mockMvc.perform(post("/api/v1/environments/env-1/start").header("X-User-Id", "alice"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("invalid_state"));
    }

    @Test
    @DisplayName("DELETE /environments/{id} returns 204")
    void destroy() throws Exception {
        mockMvc.perform(delete("/api/v1/environments/env-1").header("X-User-Id", "alice"))
                .andExpect(status().isNoContent());

        verify(lifecycleManager).destroy("env-1", alice);
    }
}
