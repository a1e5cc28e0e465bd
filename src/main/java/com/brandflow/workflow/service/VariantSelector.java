package com.brandflow.workflow.service;

import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.exception.VariantNotFoundException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AgentType;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Map;

/**
 * Records the user's choice among the variants of a visual step and moves the session on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariantSelector {

    public static final String TOOL_SELECT_VARIANT = "select_variant";

    private final SessionStateCommitter committer;
    private final Clock clock;

    /**
     * @param reference the variant URL or its durable blob key
     * @throws VariantNotFoundException when the reference is not in the current variant set
     * @throws com.brandflow.workflow.exception.ExpiredSessionException when the session expired
     */
    public Selection select(String sessionId, WorkflowStep step, String reference) {
        if (!step.isVisual()) {
            throw new ValidationException("Step " + step.key() + " has no variants to select.");
        }
        if (!StringUtils.hasText(reference)) {
            throw new ValidationException("selectedVariantUrl is required.");
        }
        WorkflowStep next = step.next()
                .orElseThrow(() -> new IllegalStateException("Visual step " + step.key() + " has no successor."));

        WorkflowSession current = committer.loadMutable(sessionId);
        GeneratedVariant chosen = current.variantSet(step)
                .flatMap(set -> set.find(reference))
                .orElseThrow(() -> new VariantNotFoundException("Variant '" + reference + "' is not among the "
                        + step.key() + " variants of session " + sessionId + "."));

        boolean alreadySelected = current.variantSet(step)
                .flatMap(VariantSet::selected)
                .map(selected -> selected.url().equals(chosen.url()))
                .orElse(false);
        if (alreadySelected && current.getCurrentStep() == next.number()) {
            log.debug("Variant {} already selected for session {}", chosen.url(), sessionId);
            return new Selection(current, chosen, next);
        }
        if (current.getCurrentStep() == next.number() && current.variantSet(next).isPresent()) {
            throw new ValidationException("Session " + sessionId + " already generated " + next.key()
                    + " variants; the " + step.key() + " selection can no longer change.");
        }

        long startedAt = System.nanoTime();
        WorkflowSession saved = committer.commit(sessionId, next, session -> {
            VariantSet set = session.variantSet(step)
                    .filter(candidate -> candidate.contains(chosen.url()))
                    .orElseThrow(() -> new VariantNotFoundException("Variant '" + reference
                            + "' disappeared from session " + sessionId + "."));
            session.replaceVariantSet(set.withSelection(chosen.url()));
            return AgentExecutionRecord.success(AgentType.forStep(step), TOOL_SELECT_VARIANT,
                    (System.nanoTime() - startedAt) / 1_000_000,
                    Map.of("style", chosen.style(), "provider", chosen.providerId(),
                            "fallback", String.valueOf(chosen.fallback())),
                    clock.instant());
        });
        log.info("Session {} selected {} variant {} ({}), now at step {}", sessionId, step.key(), chosen.style(),
                chosen.providerId(), next.number());
        return new Selection(saved, chosen, next);
    }

    public record Selection(WorkflowSession session, GeneratedVariant variant, WorkflowStep nextStep) {
    }
}
