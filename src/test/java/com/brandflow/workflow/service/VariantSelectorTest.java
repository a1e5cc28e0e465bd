package com.brandflow.workflow.service;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.support.InMemorySessionStore;
import com.brandflow.support.MutableClock;
import com.brandflow.support.SessionFixtures;
import com.brandflow.workflow.exception.ExpiredSessionException;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.exception.VariantNotFoundException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class VariantSelectorTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private InMemorySessionStore store;
    private MutableClock clock;
    private VariantSelector selector;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = new MutableClock(START);
        SessionStateCommitter committer = new SessionStateCommitter(store, new GenerationMetricsService(), clock,
                new BrandFlowProperties());
        selector = new VariantSelector(committer, clock);
    }

    @Test
    void testSelectionAdvancesToNextStep() {
        WorkflowSession session = signageGenerated();
        GeneratedVariant modern = SessionFixtures.variant(WorkflowStep.SIGNAGE, "modern", START);

        VariantSelector.Selection selection = selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, modern.url());

        assertEquals(WorkflowStep.INTERIOR, selection.nextStep());
        assertEquals("modern", selection.variant().style());
        WorkflowSession stored = store.find(session.getSessionId()).orElseThrow();
        assertEquals(4, stored.getCurrentStep());
        assertEquals(modern.url(), stored.getSignage().selectedUrl());
        AgentExecutionRecord record = stored.getExecutionLog().get(stored.getExecutionLog().size() - 1);
        assertEquals(VariantSelector.TOOL_SELECT_VARIANT, record.tool());
        assertEquals("modern", record.metadata().get("style"));
    }

    @Test
    void testSelectionByBlobKey() {
        WorkflowSession session = signageGenerated();

        VariantSelector.Selection selection = selector.select(session.getSessionId(), WorkflowStep.SIGNAGE,
                "signage/fixture/classic.png");

        assertEquals("classic", selection.variant().style());
        assertEquals(selection.variant().url(), selection.session().getSignage().selectedUrl());
    }

    @Test
    void testUnknownVariantIsRejectedWithoutWrite() {
        WorkflowSession session = signageGenerated();
        int puts = store.putCount();

        assertThrows(VariantNotFoundException.class,
                () -> selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, "https://elsewhere.test/x.png"));
        assertEquals(puts, store.putCount());
        assertEquals(3, store.find(session.getSessionId()).orElseThrow().getCurrentStep());
    }

    @Test
    void testSelectingSameVariantTwiceWritesOnce() {
        WorkflowSession session = signageGenerated();
        String url = SessionFixtures.variant(WorkflowStep.SIGNAGE, "vibrant", START).url();

        selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, url);
        int puts = store.putCount();
        VariantSelector.Selection again = selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, url);

        assertEquals(puts, store.putCount());
        assertEquals(WorkflowStep.INTERIOR, again.nextStep());
        assertEquals(url, again.session().getSignage().selectedUrl());
    }

    @Test
    void testSelectionMayChangeUntilNextStepGenerated() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.INTERIOR, START);
        String classic = SessionFixtures.variant(WorkflowStep.SIGNAGE, "classic", START).url();

        VariantSelector.Selection changed = selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, classic);
        assertEquals(classic, changed.session().getSignage().selectedUrl());

        store.tamper(session.getSessionId(), current -> {
            current.setInterior(SessionFixtures.variants(WorkflowStep.INTERIOR, START, "cozy"));
            return current;
        });
        String modern = SessionFixtures.variant(WorkflowStep.SIGNAGE, "modern", START).url();
        assertThrows(ValidationException.class,
                () -> selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, modern));
    }

    @Test
    void testInteriorSelectionMovesToReport() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.INTERIOR, START);
        store.tamper(session.getSessionId(), current -> {
            current.setInterior(SessionFixtures.variants(WorkflowStep.INTERIOR, START, "cozy", "modern", "luxury"));
            return current;
        });

        VariantSelector.Selection selection = selector.select(session.getSessionId(), WorkflowStep.INTERIOR,
                SessionFixtures.variant(WorkflowStep.INTERIOR, "luxury", START).url());

        assertEquals(WorkflowStep.REPORT, selection.nextStep());
        assertEquals(5, selection.session().getCurrentStep());
    }

    @Test
    void testExpiredSessionCannotSelect() {
        WorkflowSession session = signageGenerated();
        clock.advance(Duration.ofDays(2));

        assertThrows(ExpiredSessionException.class, () -> selector.select(session.getSessionId(), WorkflowStep.SIGNAGE,
                SessionFixtures.variant(WorkflowStep.SIGNAGE, "modern", START).url()));
    }

    @Test
    void testOnlyVisualStepsHaveSelections() {
        WorkflowSession session = signageGenerated();

        assertThrows(ValidationException.class,
                () -> selector.select(session.getSessionId(), WorkflowStep.NAMING, "anything"));
        assertThrows(ValidationException.class,
                () -> selector.select(session.getSessionId(), WorkflowStep.SIGNAGE, " "));
    }

    private WorkflowSession signageGenerated() {
        WorkflowSession session = SessionFixtures.atStep(store, WorkflowStep.SIGNAGE, START);
        VariantSet signage = SessionFixtures.variants(WorkflowStep.SIGNAGE, START, "vibrant", "modern", "classic");
        store.tamper(session.getSessionId(), current -> {
            current.setSignage(signage);
            return current;
        });
        return store.find(session.getSessionId()).orElseThrow();
    }
}
