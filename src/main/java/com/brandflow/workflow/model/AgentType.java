package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentType {
    SUPERVISOR,
    MARKET_ANALYST,
    NAMING,
    SIGNAGE,
    INTERIOR,
    REPORT_GENERATOR;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentType forStep(WorkflowStep step) {
        return switch (step) {
            case ANALYSIS -> MARKET_ANALYST;
            case NAMING -> NAMING;
            case SIGNAGE -> SIGNAGE;
            case INTERIOR -> INTERIOR;
            case REPORT -> REPORT_GENERATOR;
        };
    }
}
