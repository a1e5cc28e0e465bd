package com.brandflow.workflow.service;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.support.InMemorySessionStore;
import com.brandflow.support.MutableClock;
import com.brandflow.support.SessionFixtures;
import com.brandflow.workflow.exception.SessionNotFoundException;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.ExecutionStatus;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowSessionServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private InMemorySessionStore store;
    private MutableClock clock;
    private WorkflowSessionService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = new MutableClock(START);
        BrandFlowProperties properties = new BrandFlowProperties();
        properties.getSession().setTtl(Duration.ofHours(2));
        SessionStateCommitter committer = new SessionStateCommitter(store, new GenerationMetricsService(), clock, properties);
        service = new WorkflowSessionService(store, committer, properties, clock);
    }

    @Test
    void testCreateStartsAtAnalysis() {
        WorkflowSession session = service.create(SessionFixtures.restaurantProfile());

        assertNotNull(session.getSessionId());
        assertEquals(1, session.getCurrentStep());
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        assertEquals(START.plus(Duration.ofHours(2)), session.getExpiresAt());
        assertEquals("start_session", session.getExecutionLog().get(0).tool());
        assertTrue(store.contains(session.getSessionId()));
    }

    @Test
    void testRecordAnalysisMovesToNaming() {
        WorkflowSession session = service.create(SessionFixtures.restaurantProfile());

        WorkflowSession saved = service.recordAnalysis(session.getSessionId(), " Busy lunch street ", 81.5,
                List.of("Office workers", " ", "Few competitors"));

        assertEquals(2, saved.getCurrentStep());
        assertEquals("Busy lunch street", saved.getAnalysis().summary());
        assertEquals(List.of("Office workers", "Few competitors"), saved.getAnalysis().insights());
        assertEquals(WorkflowSessionService.TOOL_RECORD_ANALYSIS,
                saved.getExecutionLog().get(saved.getExecutionLog().size() - 1).tool());
    }

    @Test
    void testRecordAnalysisValidation() {
        String id = service.create(SessionFixtures.restaurantProfile()).getSessionId();

        assertThrows(ValidationException.class, () -> service.recordAnalysis(id, "", 50, List.of("x")));
        assertThrows(ValidationException.class, () -> service.recordAnalysis(id, "ok", 120, List.of("x")));
        assertThrows(ValidationException.class, () -> service.recordAnalysis(id, "ok", 50, List.of()));
    }

    @Test
    void testAnalysisCannotBeRecordedLater() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.SIGNAGE, START);

        assertThrows(ValidationException.class,
                () -> service.recordAnalysis(session.getSessionId(), "late", 10, List.of("x")));
    }

    @Test
    void testCompleteFromReport() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.REPORT, START);

        WorkflowSession completed = service.complete(session.getSessionId());

        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertThrows(ValidationException.class, () -> service.complete(session.getSessionId()));
    }

    @Test
    void testCompleteTooEarly() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.INTERIOR, START);

        assertThrows(ValidationException.class, () -> service.complete(session.getSessionId()));
        assertEquals(SessionStatus.ACTIVE, service.get(session.getSessionId()).getStatus());
    }

    @Test
    void testFailKeepsStepAndRecordsReason() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.NAMING, START);

        WorkflowSession failed = service.fail(session.getSessionId(), "user abandoned");

        assertEquals(SessionStatus.FAILED, failed.getStatus());
        assertEquals(2, failed.getCurrentStep());
        assertEquals("user abandoned", failed.getFailureReason());
        AgentExecutionRecord record = failed.getExecutionLog().get(failed.getExecutionLog().size() - 1);
        assertEquals(ExecutionStatus.ERROR, record.status());
        assertEquals("user abandoned", record.errorMessage());
    }

    @Test
    void testGetExpiresOverdueSession() {
        WorkflowSession session = service.create(SessionFixtures.restaurantProfile());
        clock.advance(Duration.ofHours(3));

        assertEquals(SessionStatus.EXPIRED, service.get(session.getSessionId()).getStatus());
        assertThrows(SessionNotFoundException.class, () -> service.get("missing"));
    }

    @Test
    void testStatistics() {
        service.create(SessionFixtures.restaurantProfile());
        SessionFixtures.atStep(store, WorkflowStep.SIGNAGE, START);
        WorkflowSession failed = SessionFixtures.atStep(store, WorkflowStep.NAMING, START);
        service.fail(failed.getSessionId(), "gone");

        WorkflowSessionService.SessionStatistics statistics = service.statistics();

        assertEquals(3, statistics.total());
        assertEquals(2L, statistics.byStatus().get("active"));
        assertEquals(1L, statistics.byStatus().get("failed"));
        assertEquals(1L, statistics.byStep().get(3));
        assertEquals(START, statistics.generatedAt());
    }
}
