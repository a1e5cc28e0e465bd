package com.brandflow.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record GenerateRequest(
        @NotBlank String sessionId,
        String priorStepArtifact,
        @Valid BusinessProfileRequest businessProfile,
        @Pattern(regexp = "(?i)generate|select") String action,
        List<String> styles,
        String selectedVariantUrl
) {

    public boolean isSelect() {
        return action != null && action.equalsIgnoreCase("select");
    }
}
