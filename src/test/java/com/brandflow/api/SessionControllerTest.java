package com.brandflow.api;

import com.brandflow.support.SessionFixtures;
import com.brandflow.workflow.exception.ExpiredSessionException;
import com.brandflow.workflow.exception.SessionNotFoundException;
import com.brandflow.workflow.exception.SessionVersionConflictException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AgentType;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.service.WorkflowSessionService;
import com.brandflow.workflow.service.WorkflowSessionService.SessionStatistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkflowSessionService sessionService;

    @Test
    void testCreateSession() throws Exception {
        WorkflowSession session = WorkflowSession.start(SessionFixtures.restaurantProfile(), NOW, NOW.plus(Duration.ofHours(24)));
        when(sessionService.create(any())).thenReturn(session);

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"businessProfile": {"industry": "restaurant", "region": "seoul", "size": "small"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value(session.getSessionId()))
                .andExpect(jsonPath("$.currentStep").value(1))
                .andExpect(jsonPath("$.stepName").value("analysis"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.businessProfile.industry").value("restaurant"))
                .andExpect(jsonPath("$.expiresAt").value("2026-03-02T10:00:00Z"));
    }

    @Test
    void testCreateWithUnknownIndustry() throws Exception {
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"businessProfile": {"industry": "spaceport", "region": "seoul", "size": "small"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PROFILE"));
        verify(sessionService, never()).create(any());
    }

    @Test
    void testCreateWithoutProfile() throws Exception {
        mockMvc.perform(post("/api/sessions").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.fieldErrors.businessProfile").exists());
    }

    @Test
    void testGetUnknownSession() throws Exception {
        when(sessionService.get("missing")).thenThrow(new SessionNotFoundException("Session missing not found."));

        mockMvc.perform(get("/api/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void testGetExpiredSessionIsReadable() throws Exception {
        WorkflowSession session = WorkflowSession.start(SessionFixtures.restaurantProfile(), NOW, NOW.plusSeconds(1));
        session.setStatus(SessionStatus.EXPIRED);
        when(sessionService.get(session.getSessionId())).thenReturn(session);

        mockMvc.perform(get("/api/sessions/" + session.getSessionId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("expired"));
    }

    @Test
    void testRecordAnalysis() throws Exception {
        WorkflowSession session = WorkflowSession.start(SessionFixtures.restaurantProfile(), NOW, NOW.plus(Duration.ofHours(24)));
        session.setCurrentStep(2);
        when(sessionService.recordAnalysis(eq(session.getSessionId()), anyString(), anyDouble(), anyList()))
                .thenReturn(session);

        mockMvc.perform(post("/api/sessions/" + session.getSessionId() + "/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"summary\": \"Busy street\", \"score\": 70, \"insights\": [\"Lunch crowd\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStep").value(2))
                .andExpect(jsonPath("$.stepName").value("naming"));
    }

    @Test
    void testCompleteExpiredSession() throws Exception {
        when(sessionService.complete("s1")).thenThrow(new ExpiredSessionException("Session s1 has expired."));

        mockMvc.perform(post("/api/sessions/s1/complete"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));
    }

    @Test
    void testFailWithConcurrentWriter() throws Exception {
        when(sessionService.fail(eq("s1"), any())).thenThrow(new SessionVersionConflictException("modified concurrently"));

        mockMvc.perform(post("/api/sessions/s1/fail")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"gave up\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERSION_CONFLICT"));
    }

    @Test
    void testStatistics() throws Exception {
        when(sessionService.statistics()).thenReturn(new SessionStatistics(
                Map.of("active", 2L, "completed", 1L), Map.of(1, 1L, 5, 2L), NOW));

        mockMvc.perform(get("/api/sessions/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byStatus.active").value(2))
                .andExpect(jsonPath("$.byStep['5']").value(2));
    }

    @Test
    void testExecutionLogIsExposed() throws Exception {
        WorkflowSession session = WorkflowSession.start(SessionFixtures.restaurantProfile(), NOW, NOW.plus(Duration.ofHours(24)));
        session.appendExecution(AgentExecutionRecord.success(AgentType.SUPERVISOR, "start_session", 0L, Map.of(), NOW));
        when(sessionService.get(session.getSessionId())).thenReturn(session);

        mockMvc.perform(get("/api/sessions/" + session.getSessionId()))
                .andExpect(jsonPath("$.executionLog[0].tool").value("start_session"))
                .andExpect(jsonPath("$.executionLog[0].agent").value("supervisor"))
                .andExpect(jsonPath("$.names").doesNotExist())
                .andExpect(jsonPath("$.signage").doesNotExist());
    }
}
