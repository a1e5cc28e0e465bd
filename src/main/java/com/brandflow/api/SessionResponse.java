package com.brandflow.api;

import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AnalysisSummary;
import com.brandflow.workflow.model.BusinessProfile;
import com.brandflow.workflow.model.NameSuggestionSet;
import com.brandflow.workflow.model.WorkflowSession;

import java.time.Instant;
import java.util.List;

public record SessionResponse(
        String sessionId,
        int currentStep,
        String stepName,
        String status,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt,
        long version,
        BusinessProfile businessProfile,
        AnalysisSummary analysis,
        NameSuggestionSet names,
        VariantSetView signage,
        VariantSetView interior,
        String failureReason,
        List<AgentExecutionRecord> executionLog
) {

    public static SessionResponse from(WorkflowSession session) {
        return new SessionResponse(
                session.getSessionId(),
                session.getCurrentStep(),
                session.getStep().key(),
                session.getStatus().value(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getExpiresAt(),
                session.getVersion(),
                session.getBusinessProfile(),
                session.getAnalysis(),
                session.getNames(),
                VariantSetView.from(session.getSignage()),
                VariantSetView.from(session.getInterior()),
                session.getFailureReason(),
                session.getExecutionLog());
    }
}
