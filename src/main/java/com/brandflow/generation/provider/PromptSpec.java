package com.brandflow.generation.provider;

import com.brandflow.workflow.model.WorkflowStep;
import org.springframework.lang.Nullable;

/**
 * Input of one generation call. {@code size} and {@code quality} fall back to the provider
 * defaults when null.
 */
public record PromptSpec(
        String sessionId,
        WorkflowStep step,
        String style,
        String prompt,
        @Nullable String size,
        @Nullable String quality
) {

    public static PromptSpec of(String sessionId, WorkflowStep step, String style, String prompt) {
        return new PromptSpec(sessionId, step, style, prompt, null, null);
    }
}
