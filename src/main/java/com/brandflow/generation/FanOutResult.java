package com.brandflow.generation;

import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.WorkflowStep;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Ordered outcome of a fan-out: exactly one slot per requested style, in request order.
 *
 * @param skippedReason set when no provider was called at all
 */
public record FanOutResult(
        WorkflowStep step,
        List<SlotOutcome> slots,
        long elapsedMs,
        @Nullable String skippedReason
) {

    public FanOutResult {
        slots = List.copyOf(slots);
    }

    public List<GeneratedVariant> variants() {
        return slots.stream().map(SlotOutcome::variant).toList();
    }

    public int generatedCount() {
        return (int) slots.stream().filter(slot -> !slot.fallback()).count();
    }

    public int fallbackCount() {
        return slots.size() - generatedCount();
    }

    public boolean allFallback() {
        return generatedCount() == 0;
    }
}
