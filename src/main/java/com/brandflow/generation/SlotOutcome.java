package com.brandflow.generation;

import com.brandflow.workflow.model.GeneratedVariant;
import org.springframework.lang.Nullable;

/**
 * What happened to one slot of a fan-out: the variant that fills it and, for diagnostics,
 * why it is a fallback when it is one.
 */
public record SlotOutcome(
        int index,
        String style,
        String providerId,
        GeneratedVariant variant,
        int attempts,
        @Nullable String errorType,
        long latencyMs
) {

    public boolean fallback() {
        return variant.fallback();
    }
}
