package com.brandflow.generation.provider;

import org.springframework.lang.Nullable;

/**
 * Outcome of {@link ImageProviderClient#generate(PromptSpec)}. A failed call is a value, not
 * an exception, so the fan-out can decide per slot.
 */
public record ProviderResult(
        String providerId,
        boolean success,
        @Nullable String imageUrl,
        @Nullable String revisedPrompt,
        String sanitizedPrompt,
        @Nullable ProviderErrorType errorType,
        @Nullable String errorMessage,
        int attempts,
        long latencyMs
) {

    public static ProviderResult success(String providerId, ProviderResponse response, String sanitizedPrompt,
                                         int attempts, long latencyMs) {
        return new ProviderResult(providerId, true, response.imageUrl(), response.revisedPrompt(), sanitizedPrompt,
                null, null, attempts, latencyMs);
    }

    public static ProviderResult failure(String providerId, ProviderException error, String sanitizedPrompt,
                                         int attempts, long latencyMs) {
        return new ProviderResult(providerId, false, null, null, sanitizedPrompt, error.getType(), error.getMessage(),
                attempts, latencyMs);
    }
}
