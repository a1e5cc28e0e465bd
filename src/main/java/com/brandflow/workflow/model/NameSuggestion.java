package com.brandflow.workflow.model;

public record NameSuggestion(String name, String description) {
}
