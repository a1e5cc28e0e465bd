package com.brandflow.api;

import jakarta.validation.constraints.Size;

public record FailRequest(@Size(max = 2000) String reason) {
}
