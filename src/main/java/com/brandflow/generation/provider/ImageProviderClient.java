package com.brandflow.generation.provider;

import java.util.concurrent.CompletableFuture;

/**
 * One external generative image API.
 * <p>
 * Implementations sanitize the prompt, apply the per-attempt timeout and retry transient
 * failures with exponential backoff. The returned future always completes normally; failures
 * are reported through {@link ProviderResult#success()} and {@link ProviderResult#errorType()}.
 */
public interface ImageProviderClient {

    String providerId();

    CompletableFuture<ProviderResult> generate(PromptSpec spec);
}
