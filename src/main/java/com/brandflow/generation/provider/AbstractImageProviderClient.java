package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties.ProviderConfig;
import com.brandflow.generation.GenerationMetricsService;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Shared call discipline for provider clients: sanitation, per-attempt timeout, error
 * classification and exponential backoff. Subclasses only perform the single remote call.
 */
@Slf4j
public abstract class AbstractImageProviderClient implements ImageProviderClient {

    private static final int MAX_BACKOFF_SHIFT = 16;

    private final String providerId;
    private final ProviderConfig config;
    private final PromptSanitizer sanitizer;
    private final Executor executor;
    private final GenerationMetricsService metricsService;

    protected AbstractImageProviderClient(String providerId,
                                          ProviderConfig config,
                                          PromptSanitizer sanitizer,
                                          Executor executor,
                                          GenerationMetricsService metricsService) {
        this.providerId = providerId;
        this.config = config;
        this.sanitizer = sanitizer;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    protected ProviderConfig config() {
        return config;
    }

    /**
     * Performs one blocking call. Failures must be thrown as {@link ProviderException} where
     * the subclass can classify them; anything else is classified here.
     */
    protected abstract ProviderResponse invoke(String sanitizedPrompt, PromptSpec spec);

    @Override
    public CompletableFuture<ProviderResult> generate(PromptSpec spec) {
        long startedAt = System.nanoTime();
        String prompt;
        try {
            prompt = sanitizer.sanitize(spec.prompt(), config.getMaxPromptLength());
        } catch (IllegalArgumentException ex) {
            ProviderException error = new ProviderException(providerId, ProviderErrorType.INVALID_PROMPT, ex.getMessage());
            log.warn("Provider {} rejected prompt for style {} before sending: {}", providerId, spec.style(), ex.getMessage());
            return CompletableFuture.completedFuture(ProviderResult.failure(providerId, error, "", 0, elapsedMs(startedAt)));
        }
        return attempt(spec, prompt, 0, startedAt);
    }

    private CompletableFuture<ProviderResult> attempt(PromptSpec spec, String prompt, int attempt, long startedAt) {
        metricsService.recordProviderCall(providerId, spec.style());
        return CompletableFuture.supplyAsync(() -> invoke(prompt, spec), executor)
                .orTimeout(config.getAttemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, throwable) -> {
                    if (throwable == null) {
                        if (attempt > 0) {
                            log.info("Provider {} succeeded for style {} after {} attempts.", providerId, spec.style(), attempt + 1);
                        }
                        return CompletableFuture.completedFuture(
                                ProviderResult.success(providerId, response, prompt, attempt + 1, elapsedMs(startedAt)));
                    }
                    ProviderException error = classify(throwable);
                    int attemptsUsed = attempt + 1;
                    if (!error.isRetryable() || attemptsUsed >= config.getMaxAttempts()) {
                        log.warn("Provider {} failed for style {} after {} attempt(s): {} ({})", providerId, spec.style(),
                                attemptsUsed, error.getType().value(), error.getMessage());
                        return CompletableFuture.completedFuture(
                                ProviderResult.failure(providerId, error, prompt, attemptsUsed, elapsedMs(startedAt)));
                    }
                    Duration delay = backoffDelay(attempt);
                    log.info("Provider {} attempt {} for style {} failed with {}; retrying in {} ms.", providerId,
                            attemptsUsed, spec.style(), error.getType().value(), delay.toMillis());
                    metricsService.recordRetry(providerId, error.getType().value());
                    Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
                    return CompletableFuture.runAsync(() -> { }, delayed)
                            .thenCompose(ignored -> attempt(spec, prompt, attempt + 1, startedAt));
                })
                .thenCompose(Function.identity());
    }

    /**
     * Delay before the retry that follows the failed attempt {@code attempt} (0-based):
     * {@code base * 2^attempt}.
     */
    Duration backoffDelay(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), MAX_BACKOFF_SHIFT);
        return config.getBackoffBase().multipliedBy(1L << shift);
    }

    private ProviderException classify(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof TimeoutException) {
            return new ProviderException(providerId, ProviderErrorType.TIMEOUT,
                    "No response within " + config.getAttemptTimeout().toMillis() + " ms", cause);
        }
        return new ProviderException(providerId, ProviderErrorType.SERVER_ERROR,
                "Unexpected provider failure: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
