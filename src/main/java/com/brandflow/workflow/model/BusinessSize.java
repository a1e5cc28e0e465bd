package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BusinessSize {
    SMALL, MEDIUM, LARGE;

    @JsonValue
    public String key() {
        return LowercaseEnums.key(this);
    }

    public static Optional<BusinessSize> parse(String raw) {
        return LowercaseEnums.parse(BusinessSize.class, raw);
    }

    @JsonCreator
    static BusinessSize fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown business size: " + raw));
    }
}
