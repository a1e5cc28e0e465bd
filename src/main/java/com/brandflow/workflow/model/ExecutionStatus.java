package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS,
    ERROR,
    TIMEOUT,
    RETRY;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
