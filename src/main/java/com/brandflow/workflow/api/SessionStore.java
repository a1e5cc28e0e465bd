package com.brandflow.workflow.api;

import com.brandflow.workflow.model.WorkflowSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store of whole session records.
 * <p>
 * Writes are optimistic: {@link #put(WorkflowSession)} only succeeds when the stored record
 * still carries the version the caller read, and returns the record with its new version.
 */
public interface SessionStore {

    Optional<WorkflowSession> find(String sessionId);

    WorkflowSession create(WorkflowSession session);

    /**
     * @throws com.brandflow.workflow.exception.SessionVersionConflictException when another
     *         writer stored the record since it was read
     * @throws com.brandflow.workflow.exception.SessionNotFoundException when the record is gone
     */
    WorkflowSession put(WorkflowSession session);

    /**
     * Ids of sessions that are still active although their expiry lies before {@code now}.
     */
    List<String> findActiveExpiredBefore(Instant now);

    /**
     * Ids of sessions in any status whose expiry lies before {@code cutoff}.
     */
    List<String> findExpiredBefore(Instant cutoff);

    /**
     * Removes the record if its expiry still lies before {@code cutoff}.
     *
     * @return whether a record was removed
     */
    boolean deleteIfExpiredBefore(String sessionId, Instant cutoff);

    Map<String, Long> countByStatus();

    Map<Integer, Long> countByStep();
}
