package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Industry {
    RESTAURANT, RETAIL, SERVICE, HEALTHCARE, EDUCATION, TECHNOLOGY, MANUFACTURING, CONSTRUCTION, FINANCE, OTHER;

    @JsonValue
    public String key() {
        return LowercaseEnums.key(this);
    }

    public static Optional<Industry> parse(String raw) {
        return LowercaseEnums.parse(Industry.class, raw);
    }

    @JsonCreator
    static Industry fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown industry: " + raw));
    }
}
