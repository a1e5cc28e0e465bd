package com.brandflow.workflow.service;

import com.brandflow.entity.WorkflowSessionEntity;
import com.brandflow.repository.WorkflowSessionRepository;
import com.brandflow.workflow.api.SessionStore;
import com.brandflow.workflow.exception.SessionNotFoundException;
import com.brandflow.workflow.exception.SessionVersionConflictException;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSessionStore implements SessionStore {

    private final WorkflowSessionRepository repository;
    private final JsonProcessingService jsonProcessingService;

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowSession> find(String sessionId) {
        return repository.findById(sessionId)
                .map(entity -> {
                    WorkflowSession session = jsonProcessingService.readSession(sessionId, entity.getPayload());
                    session.setVersion(entity.getVersion());
                    return session;
                });
    }

    @Override
    @Transactional
    public WorkflowSession create(WorkflowSession session) {
        session.setVersion(0L);
        repository.save(WorkflowSessionEntity.builder()
                .sessionId(session.getSessionId())
                .payload(jsonProcessingService.writeSession(session))
                .status(session.getStatus().value())
                .currentStep(session.getCurrentStep())
                .version(0L)
                .expiresAt(session.getExpiresAt())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build());
        log.info("Session {} created, expires at {}", session.getSessionId(), session.getExpiresAt());
        return session;
    }

    @Override
    @Transactional
    public WorkflowSession put(WorkflowSession session) {
        long expected = session.getVersion();
        session.setVersion(expected + 1);
        int updated = repository.updateIfVersionMatches(
                session.getSessionId(),
                expected,
                expected + 1,
                jsonProcessingService.writeSession(session),
                session.getStatus().value(),
                session.getCurrentStep(),
                session.getExpiresAt(),
                session.getUpdatedAt());
        if (updated == 0) {
            session.setVersion(expected);
            if (!repository.existsById(session.getSessionId())) {
                throw new SessionNotFoundException("Session " + session.getSessionId() + " no longer exists.");
            }
            throw new SessionVersionConflictException("Session " + session.getSessionId()
                    + " was modified concurrently (expected version " + expected + ").");
        }
        return session;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findActiveExpiredBefore(Instant now) {
        return repository.findIdsExpiredBefore(now, List.of(SessionStatus.ACTIVE.value()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findExpiredBefore(Instant cutoff) {
        return repository.findIdsByExpiresAtBefore(cutoff);
    }

    @Override
    @Transactional
    public boolean deleteIfExpiredBefore(String sessionId, Instant cutoff) {
        return repository.deleteIfExpiredBefore(sessionId, cutoff) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        repository.countByStatus().forEach(row -> counts.put(row.getLabel(), row.getTotal()));
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Integer, Long> countByStep() {
        Map<Integer, Long> counts = new TreeMap<>();
        repository.countByStep().forEach(row -> counts.put(row.getStep(), row.getTotal()));
        return counts;
    }
}
