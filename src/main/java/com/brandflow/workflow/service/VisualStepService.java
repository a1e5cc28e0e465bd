package com.brandflow.workflow.service;

import com.brandflow.generation.FanOutOrchestrator;
import com.brandflow.generation.FanOutResult;
import com.brandflow.generation.StyleCatalog;
import com.brandflow.generation.StyleSlot;
import com.brandflow.generation.VisualPromptBuilder;
import com.brandflow.workflow.exception.GenerationInProgressException;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.BusinessProfile;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Signage and interior steps: checks the session, fans out one generation per style,
 * commits the ordered result and handles the user's selection.
 */
@Service
@Slf4j
public class VisualStepService {

    private final SessionStateCommitter committer;
    private final VariantSelector variantSelector;
    private final FanOutOrchestrator orchestrator;
    private final StyleCatalog styleCatalog;
    private final VisualPromptBuilder promptBuilder;
    private final SessionRunGuard runGuard;
    private final Executor workerExecutor;

    public VisualStepService(SessionStateCommitter committer,
                             VariantSelector variantSelector,
                             FanOutOrchestrator orchestrator,
                             StyleCatalog styleCatalog,
                             VisualPromptBuilder promptBuilder,
                             SessionRunGuard runGuard,
                             @Qualifier("workerExecutor") Executor workerExecutor) {
        this.committer = committer;
        this.variantSelector = variantSelector;
        this.orchestrator = orchestrator;
        this.styleCatalog = styleCatalog;
        this.promptBuilder = promptBuilder;
        this.runGuard = runGuard;
        this.workerExecutor = workerExecutor;
    }

    public CompletableFuture<VisualGeneration> generate(WorkflowStep step,
                                                        String sessionId,
                                                        @Nullable String priorStepArtifact,
                                                        @Nullable BusinessProfile suppliedProfile,
                                                        @Nullable List<String> requestedStyles) {
        requireVisual(step);
        WorkflowSession session = committer.loadMutable(sessionId);
        committer.requireStepTarget(session, step);
        committer.requirePriorArtifact(session, step);
        if (suppliedProfile != null && !suppliedProfile.equals(session.getBusinessProfile())) {
            throw new ValidationException("The business profile of session " + sessionId + " cannot change.");
        }
        if (StringUtils.hasText(priorStepArtifact) && !matchesPriorArtifact(session, step, priorStepArtifact.trim())) {
            throw new ValidationException("priorStepArtifact does not match the selection recorded for session "
                    + sessionId + ".");
        }

        List<String> styles = styleCatalog.chooseStyles(step, session.getBusinessProfile().industry(), requestedStyles);
        String businessName = session.getNames().selectedName();
        String signageStyle = session.getSignage() == null ? null
                : session.getSignage().selected().map(GeneratedVariant::style).orElse(null);
        List<StyleSlot> slots = styles.stream()
                .map(style -> new StyleSlot(style, promptBuilder.build(step, style, session.getBusinessProfile(),
                        businessName, signageStyle)))
                .toList();

        return runGuard.runExclusive(sessionId, () -> orchestrator.generate(sessionId, step, slots)
                .thenApplyAsync(result -> commit(sessionId, result), workerExecutor));
    }

    public VariantSelector.Selection select(WorkflowStep step, String sessionId, String selectedVariantUrl) {
        requireVisual(step);
        if (runGuard.isRunning(sessionId)) {
            throw new GenerationInProgressException("Session " + sessionId + " is still generating variants.");
        }
        return variantSelector.select(sessionId, step, selectedVariantUrl);
    }

    private VisualGeneration commit(String sessionId, FanOutResult result) {
        WorkflowSession saved = committer.commitVariants(sessionId, result);
        return new VisualGeneration(saved, result);
    }

    private static boolean matchesPriorArtifact(WorkflowSession session, WorkflowStep step, String artifact) {
        return switch (step) {
            case SIGNAGE -> artifact.equals(session.getNames().selectedName());
            case INTERIOR -> session.getSignage().selected()
                    .map(variant -> variant.blob().matches(artifact))
                    .orElse(false);
            default -> false;
        };
    }

    private static void requireVisual(WorkflowStep step) {
        if (!step.isVisual()) {
            throw new ValidationException("Step " + step.key() + " is not a visual step.");
        }
    }

    /**
     * A committed fan-out: the stored session and the ordered slot outcomes.
     */
    public record VisualGeneration(WorkflowSession session, FanOutResult result) {

        public VariantSet variantSet() {
            return session.variantSet(result.step()).orElseThrow();
        }
    }
}
