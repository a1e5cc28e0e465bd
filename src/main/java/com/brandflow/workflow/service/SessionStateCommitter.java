package com.brandflow.workflow.service;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.generation.FanOutResult;
import com.brandflow.generation.GenerationConstants;
import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.workflow.api.SessionStore;
import com.brandflow.workflow.exception.ExpiredSessionException;
import com.brandflow.workflow.exception.SessionNotFoundException;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AgentType;
import com.brandflow.workflow.model.ExecutionStatus;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.SessionStatus;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single write path for session records: loads, checks, mutates and writes back one whole
 * record. Every write that changes the workflow goes through {@link #commit}.
 */
@Service
@Slf4j
public class SessionStateCommitter {

    public static final String TOOL_GENERATE_VARIANTS = "generate_variants";

    private final SessionStore sessionStore;
    private final GenerationMetricsService metricsService;
    private final Clock clock;
    private final int maxVariants;

    public SessionStateCommitter(SessionStore sessionStore,
                                 GenerationMetricsService metricsService,
                                 Clock clock,
                                 BrandFlowProperties properties) {
        this.sessionStore = sessionStore;
        this.metricsService = metricsService;
        this.clock = clock;
        this.maxVariants = properties.getGeneration().getMaxVariants();
    }

    /**
     * Loads a session that may still be mutated. A session found past its expiry is moved to
     * Expired and written back before the rejection.
     *
     * @throws SessionNotFoundException when no record exists
     * @throws ExpiredSessionException  when the session is or just became Expired
     * @throws ValidationException      when the session is Completed or Failed
     */
    public WorkflowSession loadMutable(String sessionId) {
        WorkflowSession session = load(sessionId);
        if (session.getStatus() == SessionStatus.EXPIRED) {
            throw new ExpiredSessionException("Session " + sessionId + " has expired.");
        }
        if (session.getStatus().isTerminal()) {
            throw new ValidationException("Session " + sessionId + " is " + session.getStatus().value()
                    + " and can no longer change.");
        }
        return session;
    }

    /**
     * Loads a session for reading; an overdue session is transitioned to Expired on the way.
     */
    public WorkflowSession load(String sessionId) {
        WorkflowSession session = sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session " + sessionId + " not found."));
        return expireIfDue(session);
    }

    /**
     * Moves an overdue active session to Expired and persists that transition.
     */
    public WorkflowSession expireIfDue(WorkflowSession session) {
        Instant now = clock.instant();
        if (session.getStatus() != SessionStatus.ACTIVE || !session.isExpiredAt(now)) {
            return session;
        }
        session.setStatus(SessionStatus.EXPIRED);
        session.setUpdatedAt(now);
        log.info("Session {} expired at {}", session.getSessionId(), session.getExpiresAt());
        return sessionStore.put(session);
    }

    /**
     * Re-reads the session, checks that {@code target} is the current step or the one after
     * it, applies {@code mutation}, sets the step to {@code target} and writes the record back
     * with one appended execution record.
     */
    public WorkflowSession commit(String sessionId, WorkflowStep target, SessionMutation mutation) {
        WorkflowSession session = loadMutable(sessionId);
        requireStepTarget(session, target);
        AgentExecutionRecord record = mutation.apply(session);
        session.setCurrentStep(target.number());
        session.setUpdatedAt(clock.instant());
        session.appendExecution(record);
        WorkflowSession saved = sessionStore.put(session);
        metricsService.recordCommit(target.key());
        log.info("Session {} committed {} at step {} (version {})", sessionId, record.tool(), target.number(),
                saved.getVersion());
        return saved;
    }

    /**
     * Merges a fan-out result into its visual step. The step stays where it is; moving on
     * happens on selection.
     * <p>
     * When the write fails, the durable blobs of the result stay in the blob store and their
     * keys are logged for recovery; the failure is rethrown.
     */
    public WorkflowSession commitVariants(String sessionId, FanOutResult result) {
        WorkflowStep step = result.step();
        if (!step.isVisual()) {
            throw new ValidationException("Step " + step.key() + " does not hold variants.");
        }
        WorkflowSession saved;
        try {
            saved = commit(sessionId, step, session -> {
                requirePriorArtifact(session, step);
                VariantSet incoming = VariantSet.of(step, result.variants());
                if (incoming.size() > maxVariants) {
                    throw new ValidationException("A variant set holds at most " + maxVariants + " variants, got "
                            + incoming.size() + ".");
                }
                session.replaceVariantSet(carrySelection(session.variantSet(step), incoming));
                return executionRecord(step, result);
            });
        } catch (RuntimeException ex) {
            List<String> retained = result.variants().stream()
                    .filter(variant -> variant.blob().isDurable())
                    .map(variant -> variant.blob().key())
                    .toList();
            log.error("Commit of {} variants for session {} failed ({}); durable blobs retained: {}",
                    step.key(), sessionId, ex.getMessage(), retained);
            throw ex;
        }
        metricsService.logSummary();
        return saved;
    }

    /**
     * @throws ValidationException unless {@code target} equals the current step or the next one
     */
    public void requireStepTarget(WorkflowSession session, WorkflowStep target) {
        int current = session.getCurrentStep();
        if (target.number() != current && target.number() != current + 1) {
            throw new ValidationException("Session " + session.getSessionId() + " is at step " + current
                    + "; step " + target.number() + " (" + target.key() + ") cannot be committed.");
        }
    }

    /**
     * @throws ValidationException when the data a visual step builds on is missing
     */
    public void requirePriorArtifact(WorkflowSession session, WorkflowStep step) {
        switch (step) {
            case SIGNAGE -> {
                if (session.getNames() == null || session.getNames().selectedName() == null) {
                    throw new ValidationException("Signage needs a selected business name first.");
                }
            }
            case INTERIOR -> {
                if (session.getSignage() == null || session.getSignage().selected().isEmpty()) {
                    throw new ValidationException("Interior design needs a selected signage variant first.");
                }
            }
            default -> {
            }
        }
    }

    private static VariantSet carrySelection(Optional<VariantSet> existing, VariantSet incoming) {
        String previous = existing.map(VariantSet::selectedUrl).orElse(null);
        if (previous != null && incoming.contains(previous)) {
            return incoming.withSelection(previous);
        }
        return incoming.withSelection(null);
    }

    private AgentExecutionRecord executionRecord(WorkflowStep step, FanOutResult result) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(GenerationConstants.META_STYLES, result.variants().stream()
                .map(GeneratedVariant::style)
                .collect(Collectors.joining(",")));
        metadata.put(GenerationConstants.META_FALLBACKS, String.valueOf(result.fallbackCount()));
        if (result.skippedReason() != null) {
            metadata.put(GenerationConstants.META_SKIPPED, result.skippedReason());
        }
        ExecutionStatus status = ExecutionStatus.SUCCESS;
        String error = null;
        if (result.allFallback()) {
            boolean deadline = result.slots().stream()
                    .allMatch(slot -> GenerationConstants.REASON_DEADLINE.equals(slot.errorType()));
            status = deadline ? ExecutionStatus.TIMEOUT : ExecutionStatus.ERROR;
            error = "All " + result.slots().size() + " variants fell back to defaults.";
        }
        return new AgentExecutionRecord(AgentType.forStep(step), TOOL_GENERATE_VARIANTS, status, result.elapsedMs(),
                error, metadata, clock.instant());
    }

    /**
     * Change applied to a freshly loaded session inside {@link #commit}.
     */
    @FunctionalInterface
    public interface SessionMutation {

        /**
         * @return the execution record describing the change
         */
        AgentExecutionRecord apply(WorkflowSession session);
    }
}
