package com.brandflow.generation.provider;

import org.springframework.lang.Nullable;

public record ProviderResponse(String imageUrl, @Nullable String revisedPrompt) {
}
