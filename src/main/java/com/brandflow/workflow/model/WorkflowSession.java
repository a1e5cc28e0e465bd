package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of one user's progress through the branding workflow. The whole record is
 * read, modified and written back as a unit; {@code version} guards the write-back.
 */
@Getter
@Setter
@NoArgsConstructor
public class WorkflowSession {

    private String sessionId;
    private int currentStep;
    private SessionStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private long version;

    @Setter(AccessLevel.NONE)
    private BusinessProfile businessProfile;

    @Nullable
    private AnalysisSummary analysis;
    @Nullable
    private NameSuggestionSet names;
    @Nullable
    private VariantSet signage;
    @Nullable
    private VariantSet interior;
    @Nullable
    private String failureReason;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @JsonProperty("executionLog")
    private List<AgentExecutionRecord> executionLog = new ArrayList<>();

    public static WorkflowSession start(BusinessProfile profile, Instant now, Instant expiresAt) {
        WorkflowSession session = new WorkflowSession();
        session.sessionId = UUID.randomUUID().toString();
        session.currentStep = WorkflowStep.ANALYSIS.number();
        session.status = SessionStatus.ACTIVE;
        session.createdAt = now;
        session.updatedAt = now;
        session.expiresAt = expiresAt;
        session.businessProfile = profile;
        return session;
    }

    @JsonProperty("businessProfile")
    private void initBusinessProfile(BusinessProfile businessProfile) {
        this.businessProfile = businessProfile;
    }

    @JsonProperty("executionLog")
    public List<AgentExecutionRecord> getExecutionLog() {
        return Collections.unmodifiableList(executionLog);
    }

    public void appendExecution(AgentExecutionRecord record) {
        executionLog.add(record);
    }

    @JsonIgnore
    public WorkflowStep getStep() {
        return WorkflowStep.fromNumber(currentStep)
                .orElseThrow(() -> new IllegalStateException("Session " + sessionId + " has invalid step " + currentStep));
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Optional<VariantSet> variantSet(WorkflowStep step) {
        return switch (step) {
            case SIGNAGE -> Optional.ofNullable(signage);
            case INTERIOR -> Optional.ofNullable(interior);
            default -> Optional.empty();
        };
    }

    public void replaceVariantSet(VariantSet set) {
        switch (set.step()) {
            case SIGNAGE -> signage = set;
            case INTERIOR -> interior = set;
            default -> throw new IllegalArgumentException("Step " + set.step() + " holds no variants.");
        }
    }
}
