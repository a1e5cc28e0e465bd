package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

public record BlobReference(
        String url,
        @Nullable String key,
        BlobStorage storage,
        @Nullable Instant expiresAt,
        @Nullable String note
) {

    public BlobReference {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(storage, "storage");
    }

    public static BlobReference durable(String url, String key, @Nullable Instant urlExpiresAt) {
        return new BlobReference(url, key, BlobStorage.DURABLE, urlExpiresAt, null);
    }

    public static BlobReference providerTransient(String url, @Nullable Instant expiresAt, String reason) {
        return new BlobReference(url, null, BlobStorage.PROVIDER_TRANSIENT, expiresAt, reason);
    }

    public static BlobReference fallback(String url) {
        return new BlobReference(url, null, BlobStorage.FALLBACK, null, null);
    }

    @JsonIgnore
    public boolean isDurable() {
        return storage == BlobStorage.DURABLE;
    }

    public boolean matches(@Nullable String reference) {
        if (reference == null) {
            return false;
        }
        return url.equals(reference) || (key != null && key.equals(reference));
    }
}
