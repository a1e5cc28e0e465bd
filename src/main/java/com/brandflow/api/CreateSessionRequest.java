package com.brandflow.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CreateSessionRequest(
        @NotNull @Valid BusinessProfileRequest businessProfile
) {
}
