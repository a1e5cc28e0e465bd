package com.brandflow.api;

import jakarta.validation.constraints.NotBlank;

public record SelectRequest(
        @NotBlank String sessionId,
        @NotBlank String selectedVariantUrl
) {
}
