package com.brandflow.api;

import com.brandflow.workflow.model.NameSuggestion;
import com.brandflow.workflow.model.NameSuggestionSet;
import com.brandflow.workflow.model.WorkflowSession;

import java.util.List;

public record NamesResponse(
        String sessionId,
        List<NameSuggestion> suggestions,
        String selectedName,
        int regenerationCount,
        int remainingRegenerations,
        int currentStep
) {

    public static NamesResponse from(WorkflowSession session, int maxRegenerations) {
        NameSuggestionSet names = session.getNames();
        if (names == null) {
            return new NamesResponse(session.getSessionId(), List.of(), null, 0, maxRegenerations,
                    session.getCurrentStep());
        }
        return new NamesResponse(session.getSessionId(), names.suggestions(), names.selectedName(),
                names.regenerationCount(), Math.max(0, maxRegenerations - names.regenerationCount()),
                session.getCurrentStep());
    }
}
