package com.brandflow.generation.provider;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProviderErrorType {
    RATE_LIMIT("rate_limit", true),
    INVALID_PROMPT("invalid_prompt", false),
    SERVER_ERROR("server_error", true),
    TIMEOUT("timeout", true),
    NETWORK_ERROR("network_error", true),
    MISSING_CREDENTIALS("missing_credentials", false);

    private final String value;
    private final boolean retryable;

    ProviderErrorType(String value, boolean retryable) {
        this.value = value;
        this.retryable = retryable;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ProviderErrorType fromStatus(int status) {
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return MISSING_CREDENTIALS;
        }
        if (status >= 400 && status < 500) {
            return INVALID_PROMPT;
        }
        return SERVER_ERROR;
    }
}
