package com.brandflow.api;

import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.WorkflowStep;
import com.brandflow.workflow.service.VisualStepService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Signage ({@code /api/visuals/signage}) and interior ({@code /api/visuals/interior}) steps.
 */
@RestController
@RequestMapping("/api/visuals/{step}")
public class VisualController {

    private final VisualStepService visualStepService;

    public VisualController(VisualStepService visualStepService) {
        this.visualStepService = visualStepService;
    }

    /**
     * Generates variants, or selects one when {@code action} is {@code select}.
     */
    @PostMapping
    public CompletableFuture<?> handle(@PathVariable("step") String stepKey, @Valid @RequestBody GenerateRequest request) {
        WorkflowStep step = visualStep(stepKey);
        if (request.isSelect()) {
            return CompletableFuture.completedFuture(SelectResponse.from(
                    visualStepService.select(step, request.sessionId(), request.selectedVariantUrl())));
        }
        return visualStepService.generate(step,
                        request.sessionId(),
                        request.priorStepArtifact(),
                        request.businessProfile() == null ? null : request.businessProfile().toProfile(),
                        request.styles())
                .thenApply(GenerateResponse::from);
    }

    @PostMapping("/select")
    public SelectResponse select(@PathVariable("step") String stepKey, @Valid @RequestBody SelectRequest request) {
        return SelectResponse.from(visualStepService.select(visualStep(stepKey), request.sessionId(),
                request.selectedVariantUrl()));
    }

    private static WorkflowStep visualStep(String key) {
        return WorkflowStep.fromKey(key)
                .filter(WorkflowStep::isVisual)
                .orElseThrow(() -> new ValidationException("Unknown visual step '" + key + "'. Use signage or interior."));
    }
}
