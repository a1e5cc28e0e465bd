package com.brandflow.api;

import com.brandflow.generation.GenerationConstants;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.service.VisualStepService.VisualGeneration;

import java.util.List;

public record GenerateResponse(
        String sessionId,
        List<VariantView> variants,
        int totalGenerated,
        boolean canProceed,
        String message
) {

    public static GenerateResponse from(VisualGeneration generation) {
        VariantSet set = generation.variantSet();
        List<VariantView> variants = set.variants().stream()
                .map(variant -> VariantView.from(variant, set.selectedUrl()))
                .toList();
        int generated = generation.result().generatedCount();
        String step = set.step().key();
        String message = generated == 0
                ? GenerationConstants.ALL_FALLBACK_MESSAGE.formatted(variants.size(), step)
                : GenerationConstants.GENERATED_MESSAGE.formatted(generated, variants.size(), step);
        return new GenerateResponse(generation.session().getSessionId(), variants, generated, true, message);
    }
}
