package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the bytes behind a variant actually live.
 */
public enum BlobStorage {
    /** Copied into the blob store under a deterministic key. */
    DURABLE("durable"),
    /** Still hosted by the provider; the URL is time-limited. */
    PROVIDER_TRANSIENT("provider_transient"),
    /** Pre-registered substitute artifact. */
    FALLBACK("fallback");

    private final String value;

    BlobStorage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
