package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed"),
    EXPIRED("expired");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
