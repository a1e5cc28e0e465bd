package com.brandflow.workflow.service;

import com.brandflow.blob.BlobStore;
import com.brandflow.config.BrandFlowProperties;
import com.brandflow.workflow.api.SessionStore;
import com.brandflow.workflow.exception.BrandFlowException;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Marks overdue sessions as Expired and, once the retention grace period after their expiry
 * has passed, removes their stored artifacts and then their records.
 */
@Component
@Slf4j
public class ExpiredSessionSweeper {

    private final SessionStore sessionStore;
    private final SessionStateCommitter committer;
    private final BlobStore blobStore;
    private final BrandFlowProperties properties;
    private final Clock clock;

    public ExpiredSessionSweeper(SessionStore sessionStore,
                                 SessionStateCommitter committer,
                                 BlobStore blobStore,
                                 BrandFlowProperties properties,
                                 Clock clock) {
        this.sessionStore = sessionStore;
        this.committer = committer;
        this.blobStore = blobStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${brandflow.session.sweep-interval:10m}",
            initialDelayString = "${brandflow.session.sweep-interval:10m}")
    public void sweep() {
        Instant now = clock.instant();
        int expired = markExpired(now);
        int deleted = purgeExpiredBefore(now.minus(properties.getSession().getRetentionAfterExpiry()));
        if (expired > 0 || deleted > 0) {
            log.info("Session sweep: {} marked expired, {} removed", expired, deleted);
        }
    }

    /**
     * @return the number of sessions this call moved from Active to Expired
     */
    int markExpired(Instant now) {
        List<String> ids = sessionStore.findActiveExpiredBefore(now);
        int count = 0;
        for (String id : ids) {
            try {
                Optional<WorkflowSession> current = sessionStore.find(id);
                if (current.isEmpty() || current.get().getStatus() != SessionStatus.ACTIVE) {
                    continue;
                }
                if (committer.expireIfDue(current.get()).getStatus() == SessionStatus.EXPIRED) {
                    count++;
                }
            } catch (BrandFlowException ex) {
                log.warn("Could not expire session {}: {}", id, ex.getMessage());
            }
        }
        return count;
    }

    /**
     * Artifacts go first; a session whose artifacts could not be removed keeps its record
     * and is retried on the next sweep.
     */
    int purgeExpiredBefore(Instant cutoff) {
        int removed = 0;
        for (String id : sessionStore.findExpiredBefore(cutoff)) {
            try {
                int blobs = deleteArtifacts(id);
                if (sessionStore.deleteIfExpiredBefore(id, cutoff)) {
                    removed++;
                    log.debug("Removed session {} and {} stored artifacts", id, blobs);
                }
            } catch (BrandFlowException ex) {
                log.warn("Could not remove session {}: {}", id, ex.getMessage());
            }
        }
        return removed;
    }

    private int deleteArtifacts(String sessionId) {
        int deleted = 0;
        for (WorkflowStep step : WorkflowStep.values()) {
            if (step.isVisual()) {
                deleted += blobStore.deletePrefix(step.key() + "/" + sessionId + "/");
            }
        }
        return deleted;
    }
}
