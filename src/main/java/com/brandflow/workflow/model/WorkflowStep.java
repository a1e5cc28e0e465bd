package com.brandflow.workflow.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum WorkflowStep {
    ANALYSIS(1, "analysis"),
    NAMING(2, "naming"),
    SIGNAGE(3, "signage"),
    INTERIOR(4, "interior"),
    REPORT(5, "report");

    private final int number;
    private final String key;

    WorkflowStep(int number, String key) {
        this.number = number;
        this.key = key;
    }

    public int number() {
        return number;
    }

    public String key() {
        return key;
    }

    public boolean isVisual() {
        return this == SIGNAGE || this == INTERIOR;
    }

    public Optional<WorkflowStep> next() {
        return fromNumber(number + 1);
    }

    public static Optional<WorkflowStep> fromNumber(int number) {
        return Arrays.stream(values()).filter(step -> step.number == number).findFirst();
    }

    public static Optional<WorkflowStep> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(step -> step.key.equals(normalized)).findFirst();
    }
}
