package com.brandflow.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AnalysisRequest(
        @NotBlank String summary,
        @DecimalMin("0") @DecimalMax("100") double score,
        @NotEmpty List<String> insights
) {
}
