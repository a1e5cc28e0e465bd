package com.brandflow.api;

import com.brandflow.workflow.model.GeneratedVariant;
import com.fasterxml.jackson.annotation.JsonProperty;

public record VariantView(
        String url,
        String provider,
        String style,
        @JsonProperty("isFallback") boolean isFallback,
        boolean durable,
        boolean selected
) {

    public static VariantView from(GeneratedVariant variant, String selectedUrl) {
        return new VariantView(variant.url(), variant.providerId(), variant.style(), variant.fallback(),
                variant.blob().isDurable(), variant.url().equals(selectedUrl));
    }
}
