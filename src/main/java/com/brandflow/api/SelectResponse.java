package com.brandflow.api;

import com.brandflow.workflow.service.VariantSelector.Selection;

public record SelectResponse(
        String sessionId,
        String selectedVariantUrl,
        int nextStep,
        boolean canProceed
) {

    public static SelectResponse from(Selection selection) {
        return new SelectResponse(selection.session().getSessionId(), selection.variant().url(),
                selection.nextStep().number(), true);
    }
}
