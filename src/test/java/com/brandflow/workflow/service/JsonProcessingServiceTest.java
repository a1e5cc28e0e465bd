package com.brandflow.workflow.service;

import com.brandflow.support.SessionFixtures;
import com.brandflow.support.InMemorySessionStore;
import com.brandflow.support.TestObjectMappers;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final JsonProcessingService service = new JsonProcessingService(TestObjectMappers.create());

    record TestBean(String name, int age) {
    }

    @Test
    void testParseJsonResponseWrappedInProse() {
        String raw = "Here are the names: {\"name\":\"Seoul Table\", \"age\":3} Enjoy!";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals("Seoul Table", bean.name());
        assertEquals(3, bean.age());
    }

    @Test
    void testParseJsonResponseInCodeFence() {
        String raw = "```json\n{\"name\":\"Noodle Harbor\", \"age\":1}\n```";
        TestBean bean = service.parseJsonResponse("test", raw, TestBean.class);
        assertNotNull(bean);
        assertEquals("Noodle Harbor", bean.name());
    }

    @Test
    void testParseEmptyResponse() {
        assertNull(service.parseJsonResponse("test", "", TestBean.class));
        assertNull(service.parseJsonResponse("test", null, TestBean.class));
    }

    @Test
    void testParseInvalidJson() {
        assertNull(service.parseJsonResponse("test", "{invalid-json}", TestBean.class));
    }

    @Test
    void testSessionPayloadSurvivesWriteAndRead() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        WorkflowSession session = SessionFixtures.atStep(new InMemorySessionStore(), WorkflowStep.REPORT, now);

        WorkflowSession read = service.readSession(session.getSessionId(), service.writeSession(session));

        assertEquals(session.getSessionId(), read.getSessionId());
        assertEquals(SessionStatus.ACTIVE, read.getStatus());
        assertEquals(session.getBusinessProfile(), read.getBusinessProfile());
        assertEquals(session.getSignage(), read.getSignage());
        assertEquals(session.getInterior().selectedUrl(), read.getInterior().selectedUrl());
        assertEquals(SessionFixtures.SELECTED_NAME, read.getNames().selectedName());
    }

    @Test
    void testUnreadablePayloadIsReported() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> service.readSession("s1", "not json"));
        assertTrue(ex.getMessage().contains("s1"));
    }
}
