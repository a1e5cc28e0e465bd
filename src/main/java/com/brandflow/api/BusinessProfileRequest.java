package com.brandflow.api;

import com.brandflow.workflow.model.BusinessProfile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record BusinessProfileRequest(
        @NotBlank String industry,
        @NotBlank String region,
        @NotBlank String size,
        @Size(max = BusinessProfile.MAX_DESCRIPTION_LENGTH) String description
) {

    public BusinessProfile toProfile() {
        return BusinessProfile.of(industry, region, size, description);
    }
}
