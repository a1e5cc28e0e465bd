package com.brandflow.workflow.service;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.workflow.api.SessionStore;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AgentType;
import com.brandflow.workflow.model.AnalysisSummary;
import com.brandflow.workflow.model.BusinessProfile;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Session lifecycle outside the generation steps: creation, reading, the analysis result,
 * completion and explicit failure.
 */
@Service
@Slf4j
public class WorkflowSessionService {

    static final String TOOL_RECORD_ANALYSIS = "record_analysis";
    static final String TOOL_COMPLETE = "complete_session";
    static final String TOOL_FAIL = "fail_session";

    private final SessionStore sessionStore;
    private final SessionStateCommitter committer;
    private final BrandFlowProperties properties;
    private final Clock clock;

    public WorkflowSessionService(SessionStore sessionStore,
                                  SessionStateCommitter committer,
                                  BrandFlowProperties properties,
                                  Clock clock) {
        this.sessionStore = sessionStore;
        this.committer = committer;
        this.properties = properties;
        this.clock = clock;
    }

    public WorkflowSession create(BusinessProfile profile) {
        Instant now = clock.instant();
        WorkflowSession session = WorkflowSession.start(profile, now, now.plus(properties.getSession().getTtl()));
        session.appendExecution(AgentExecutionRecord.success(AgentType.SUPERVISOR, "start_session", 0L,
                Map.of("industry", profile.industry().key(), "region", profile.region().key()), now));
        return sessionStore.create(session);
    }

    public WorkflowSession get(String sessionId) {
        return committer.load(sessionId);
    }

    public WorkflowSession recordAnalysis(String sessionId, String summary, double score, List<String> insights) {
        if (!StringUtils.hasText(summary)) {
            throw new ValidationException("Analysis summary is required.");
        }
        if (score < 0 || score > 100) {
            throw new ValidationException("Analysis score must be between 0 and 100.");
        }
        if (insights == null || insights.stream().noneMatch(StringUtils::hasText)) {
            throw new ValidationException("Analysis needs at least one insight.");
        }
        List<String> cleaned = insights.stream().filter(StringUtils::hasText).map(String::trim).toList();
        return committer.commit(sessionId, WorkflowStep.NAMING, session -> {
            Instant now = clock.instant();
            session.setAnalysis(new AnalysisSummary(summary.trim(), score, cleaned, now));
            return AgentExecutionRecord.success(AgentType.MARKET_ANALYST, TOOL_RECORD_ANALYSIS, 0L,
                    Map.of("score", String.valueOf(score), "insights", String.valueOf(cleaned.size())), now);
        });
    }

    public WorkflowSession complete(String sessionId) {
        return committer.commit(sessionId, WorkflowStep.REPORT, session -> {
            if (session.getCurrentStep() != WorkflowStep.REPORT.number()) {
                throw new ValidationException("Session " + sessionId + " can only complete from the report step.");
            }
            if (session.getInterior() == null || session.getInterior().selected().isEmpty()) {
                throw new ValidationException("Session " + sessionId + " has no selected interior design.");
            }
            session.setStatus(SessionStatus.COMPLETED);
            log.info("Session {} completed", sessionId);
            return AgentExecutionRecord.success(AgentType.REPORT_GENERATOR, TOOL_COMPLETE, 0L, Map.of(), clock.instant());
        });
    }

    public WorkflowSession fail(String sessionId, String reason) {
        String message = StringUtils.hasText(reason) ? reason.trim() : "unspecified";
        WorkflowSession current = committer.loadMutable(sessionId);
        WorkflowStep step = current.getStep();
        return committer.commit(sessionId, step, session -> {
            session.setStatus(SessionStatus.FAILED);
            session.setFailureReason(message);
            log.warn("Session {} failed at step {}: {}", sessionId, step.key(), message);
            return AgentExecutionRecord.error(AgentType.SUPERVISOR, TOOL_FAIL, 0L, message, clock.instant());
        });
    }

    public SessionStatistics statistics() {
        return new SessionStatistics(sessionStore.countByStatus(), sessionStore.countByStep(), clock.instant());
    }

    public record SessionStatistics(Map<String, Long> byStatus, Map<Integer, Long> byStep, Instant generatedAt) {

        public long total() {
            return byStatus.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
