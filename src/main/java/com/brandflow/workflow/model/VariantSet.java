package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered variants produced for one visual step. The order is the requested style order;
 * at most one member is selected, identified by {@code selectedUrl}.
 */
public record VariantSet(
        WorkflowStep step,
        List<GeneratedVariant> variants,
        @Nullable String selectedUrl
) {

    public VariantSet {
        Objects.requireNonNull(step, "step");
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public static VariantSet of(WorkflowStep step, List<GeneratedVariant> variants) {
        return new VariantSet(step, variants, null);
    }

    public Optional<GeneratedVariant> find(@Nullable String reference) {
        return variants.stream().filter(variant -> variant.blob().matches(reference)).findFirst();
    }

    public boolean contains(@Nullable String reference) {
        return find(reference).isPresent();
    }

    @JsonIgnore
    public Optional<GeneratedVariant> selected() {
        return selectedUrl == null ? Optional.empty() : find(selectedUrl);
    }

    public VariantSet withSelection(@Nullable String url) {
        return new VariantSet(step, variants, url);
    }

    @JsonIgnore
    public int size() {
        return variants.size();
    }

    @JsonIgnore
    public long fallbackCount() {
        return variants.stream().filter(GeneratedVariant::fallback).count();
    }
}
