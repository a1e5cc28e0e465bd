package com.brandflow.api;

import jakarta.validation.constraints.NotBlank;

public record NameSelectRequest(@NotBlank String name) {
}
