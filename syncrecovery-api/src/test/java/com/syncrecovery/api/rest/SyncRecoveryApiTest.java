package com.syncrecovery.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
    "syncrecovery.recovery.auto-backup=false",
    "syncrecovery.recovery.enable-auto-recovery=false"
})
@AutoConfigureMockMvc
@DisplayName("Sync Recovery REST API")
class SyncRecoveryApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String logEvent(String projectId) throws Exception {
        String body = """
            {"type": "DB_CHANGE", "severity": "INFO", "source": "SYNC_MANAGER",
             "data": {"table": "tasks", "projectId": "%s", "operation": "UPDATE"}}
            """.formatted(projectId);

        MvcResult result = mockMvc.perform(post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andReturn();

        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.path("data").path("id").asText();
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("Logged events can be fetched by id")
        void testLogAndFetch() throws Exception {
            String eventId = logEvent("p-" + UUID.randomUUID());

            mockMvc.perform(get("/api/v1/events/{id}", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(eventId))
                .andExpect(jsonPath("$.data.type").value("DB_CHANGE"))
                .andExpect(jsonPath("$.data.source").value("SYNC_MANAGER"));
        }

        @Test
        @DisplayName("Unknown events answer 404 with a structured error")
        void testEventNotFound() throws Exception {
            mockMvc.perform(get("/api/v1/events/{id}", "evt_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.data").doesNotExist());
        }

        @Test
        @DisplayName("Queries filter by type and paginate")
        void testQuery() throws Exception {
            logEvent("p-query");
            logEvent("p-query");

            mockMvc.perform(get("/api/v1/events")
                    .param("types", "DB_CHANGE")
                    .param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].type").value("DB_CHANGE"));
        }

        @Test
        @DisplayName("Malformed filters are rejected with 400")
        void testInvalidFilter() throws Exception {
            mockMvc.perform(get("/api/v1/events").param("types", "NOT_A_TYPE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));

            mockMvc.perform(get("/api/v1/events").param("limit", "0"))
                .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Statistics count logged events")
        void testStatistics() throws Exception {
            logEvent("p-stats");

            mockMvc.perform(get("/api/v1/events/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalEvents", greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.data.eventsByType.DB_CHANGE", greaterThanOrEqualTo(1)));
        }

        @Test
        @DisplayName("Export returns the raw document")
        void testExport() throws Exception {
            logEvent("p-export");

            mockMvc.perform(get("/api/v1/events/export").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("change-events.csv")));

            mockMvc.perform(get("/api/v1/events/export").param("format", "xml"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
        }
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        private String createSession(String projectId) throws Exception {
            String body = """
                {"name": "api replay", "filter": {"projectIds": ["%s"]},
                 "options": {"mode": "DRY_RUN", "strategy": "SEQUENTIAL"}}
                """.formatted(projectId);

            MvcResult result = mockMvc.perform(post("/api/v1/replay/sessions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andReturn();
            return objectMapper.readTree(result.getResponse().getContentAsString()).path("data").path("id").asText();
        }

        @Test
        @DisplayName("Sessions without options are rejected")
        void testMissingOptions() throws Exception {
            mockMvc.perform(post("/api/v1/replay/sessions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"no options\", \"filter\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("A dry run replays every matching event")
        void testDryRun() throws Exception {
            String projectId = "p-" + UUID.randomUUID();
            logEvent(projectId);
            logEvent(projectId);
            String sessionId = createSession(projectId);

            mockMvc.perform(get("/api/v1/replay/sessions/{id}/validation", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.issues", hasSize(0)));

            mockMvc.perform(post("/api/v1/replay/sessions/{id}/start", sessionId))
                .andExpect(status().isAccepted());

            awaitStatus(sessionId, "COMPLETED");

            mockMvc.perform(get("/api/v1/replay/sessions/{id}/results", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)));
            mockMvc.perform(get("/api/v1/replay/sessions/{id}/progress", sessionId))
                .andExpect(jsonPath("$.data.processedEvents").value(2));
        }

        @Test
        @DisplayName("Illegal transitions answer 409")
        void testInvalidTransition() throws Exception {
            String sessionId = createSession("p-" + UUID.randomUUID());

            mockMvc.perform(post("/api/v1/replay/sessions/{id}/cancel", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));

            mockMvc.perform(post("/api/v1/replay/sessions/{id}/start", sessionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("INVALID_STATE_TRANSITION"));
        }

        @Test
        @DisplayName("Deleted sessions are gone")
        void testDelete() throws Exception {
            String sessionId = createSession("p-" + UUID.randomUUID());

            mockMvc.perform(delete("/api/v1/replay/sessions/{id}", sessionId))
                .andExpect(status().isOk());
            mockMvc.perform(get("/api/v1/replay/sessions/{id}", sessionId))
                .andExpect(status().isNotFound());
        }

        private void awaitStatus(String sessionId, String expected) throws Exception {
            long deadline = System.currentTimeMillis() + 5_000;
            String status = null;
            while (System.currentTimeMillis() < deadline) {
                MvcResult result = mockMvc.perform(get("/api/v1/replay/sessions/{id}", sessionId)).andReturn();
                status = objectMapper.readTree(result.getResponse().getContentAsString())
                    .path("data").path("status").asText();
                if (expected.equals(status)) {
                    return;
                }
                Thread.sleep(20);
            }
            assertThat(status).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("Reported failures are classified and counted")
        void testReportFailure() throws Exception {
            String operationId = "op-" + UUID.randomUUID();
            String body = """
                {"operationId": "%s", "tableName": "tasks", "retryCount": 0,
                 "errorCode": "E_NET", "errorMessage": "Network connection refused"}
                """.formatted(operationId);

            mockMvc.perform(post("/api/v1/recovery/failures")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.failureType").value("NETWORK_ERROR"))
                .andExpect(jsonPath("$.data.recommendedAction").value("RETRY"))
                .andExpect(jsonPath("$.data.recoverable").value(true));

            mockMvc.perform(get("/api/v1/recovery/events")
                    .param("type", "FAILURE_DETECTED")
                    .param("operationId", operationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)));

            mockMvc.perform(get("/api/v1/recovery/statistics"))
                .andExpect(jsonPath("$.data.totalFailures", greaterThanOrEqualTo(1)));
        }

        @Test
        @DisplayName("Failures without an operation id are rejected")
        void testReportFailureValidation() throws Exception {
            mockMvc.perform(post("/api/v1/recovery/failures")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"errorMessage\": \"boom\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("The status report is available")
        void testStatusReport() throws Exception {
            mockMvc.perform(get("/api/v1/recovery/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.overallStatus").exists())
                .andExpect(jsonPath("$.data.recommendations").isArray());
        }

        @Test
        @DisplayName("Rollback points can be created, listed and restored")
        void testRollbackPoints() throws Exception {
            MvcResult created = mockMvc.perform(post("/api/v1/recovery/rollback-points")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"description\": \"before migration\", \"tables\": [\"tasks\"], \"backupType\": \"FULL\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.backupId").exists())
                .andReturn();
            String pointId = objectMapper.readTree(created.getResponse().getContentAsString())
                .path("data").path("id").asText();

            mockMvc.perform(get("/api/v1/recovery/rollback-points"))
                .andExpect(jsonPath("$.data[*].id", hasItem(pointId)));
            mockMvc.perform(post("/api/v1/recovery/rollback-points/{id}/restore", pointId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(pointId));
            mockMvc.perform(get("/api/v1/recovery/backups").param("type", "FULL"))
                .andExpect(jsonPath("$.data", not(empty())));
        }

        @Test
        @DisplayName("Unknown rollback points answer 404")
        void testUnknownRollbackPoint() throws Exception {
            mockMvc.perform(post("/api/v1/recovery/rollback-points/{id}/restore", "rb_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
        }
    }

    @Test
    @DisplayName("The actuator health endpoint includes the sync recovery indicator")
    void testHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.syncRecovery.status").value("UP"));
    }
}
