package com.brandflow.repository;

import com.brandflow.entity.WorkflowSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for {@link WorkflowSessionEntity}. Writes after creation go through
 * {@link #updateIfVersionMatches}, never through {@code save}.
 */
public interface WorkflowSessionRepository extends JpaRepository<WorkflowSessionEntity, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update WorkflowSessionEntity s
               set s.payload = :payload,
                   s.status = :status,
                   s.currentStep = :currentStep,
                   s.version = :newVersion,
                   s.expiresAt = :expiresAt,
                   s.updatedAt = :updatedAt
             where s.sessionId = :sessionId
               and s.version = :expectedVersion
            """)
    int updateIfVersionMatches(@Param("sessionId") String sessionId,
                               @Param("expectedVersion") long expectedVersion,
                               @Param("newVersion") long newVersion,
                               @Param("payload") String payload,
                               @Param("status") String status,
                               @Param("currentStep") int currentStep,
                               @Param("expiresAt") Instant expiresAt,
                               @Param("updatedAt") Instant updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from WorkflowSessionEntity s where s.sessionId = :sessionId and s.expiresAt < :cutoff")
    int deleteIfExpiredBefore(@Param("sessionId") String sessionId, @Param("cutoff") Instant cutoff);

    @Query("select s.sessionId from WorkflowSessionEntity s where s.expiresAt < :cutoff")
    List<String> findIdsByExpiresAtBefore(@Param("cutoff") Instant cutoff);

    @Query("select s.sessionId from WorkflowSessionEntity s where s.expiresAt < :now and s.status in :statuses")
    List<String> findIdsExpiredBefore(@Param("now") Instant now, @Param("statuses") Collection<String> statuses);

    @Query("select s.status as label, count(s) as total from WorkflowSessionEntity s group by s.status")
    List<GroupCount> countByStatus();

    @Query("select s.currentStep as step, count(s) as total from WorkflowSessionEntity s group by s.currentStep")
    List<StepCount> countByStep();

    interface GroupCount {
        String getLabel();

        long getTotal();
    }

    interface StepCount {
        int getStep();

        long getTotal();
    }
}
