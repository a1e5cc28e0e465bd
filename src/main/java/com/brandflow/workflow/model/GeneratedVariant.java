package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record GeneratedVariant(
        String providerId,
        String style,
        String prompt,
        @Nullable String revisedPrompt,
        BlobReference blob,
        Instant generatedAt,
        boolean fallback,
        Map<String, String> metadata
) {

    public GeneratedVariant {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(blob, "blob");
        Objects.requireNonNull(generatedAt, "generatedAt");
        prompt = prompt == null ? "" : prompt;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @JsonIgnore
    public String url() {
        return blob.url();
    }
}
