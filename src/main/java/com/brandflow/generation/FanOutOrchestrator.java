package com.brandflow.generation;

import com.brandflow.blob.BlobPersister;
import com.brandflow.generation.provider.ImageProviderClient;
import com.brandflow.generation.provider.ImageProviderClientFactory;
import com.brandflow.generation.provider.PromptSpec;
import com.brandflow.generation.provider.ProviderException;
import com.brandflow.generation.provider.ProviderResult;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.BlobReference;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.brandflow.generation.GenerationConstants.META_ATTEMPTS;
import static com.brandflow.generation.GenerationConstants.REASON_CLIENT_UNAVAILABLE;
import static com.brandflow.generation.GenerationConstants.REASON_DEADLINE;
import static com.brandflow.generation.GenerationConstants.REASON_NO_PROVIDERS;
import static com.brandflow.generation.GenerationConstants.REASON_UNEXPECTED;

/**
 * Runs one generate-then-persist pipeline per style concurrently under a single global
 * deadline and folds the results back into request order.
 * <p>
 * Slots still running at the deadline are abandoned, not cancelled, so an in-flight blob
 * write is never cut in half; their places are taken by fallback variants. Generation
 * failure never fails the returned future.
 */
@Slf4j
public class FanOutOrchestrator {

    private final ImageProviderClientFactory clientFactory;
    private final List<String> providerIds;
    private final BlobPersister blobPersister;
    private final FallbackCatalog fallbackCatalog;
    private final GenerationMetricsService metricsService;
    private final Executor executor;
    private final Duration globalTimeout;
    private final int maxVariants;
    private final Clock clock;

    public FanOutOrchestrator(ImageProviderClientFactory clientFactory,
                              List<String> providerIds,
                              BlobPersister blobPersister,
                              FallbackCatalog fallbackCatalog,
                              GenerationMetricsService metricsService,
                              Executor executor,
                              Duration globalTimeout,
                              int maxVariants,
                              Clock clock) {
        this.clientFactory = clientFactory;
        this.providerIds = List.copyOf(providerIds);
        this.blobPersister = blobPersister;
        this.fallbackCatalog = fallbackCatalog;
        this.metricsService = metricsService;
        this.executor = executor;
        this.globalTimeout = globalTimeout;
        this.maxVariants = maxVariants;
        this.clock = clock;
    }

    public CompletableFuture<FanOutResult> generate(String sessionId, WorkflowStep step, List<StyleSlot> slots) {
        if (slots == null || slots.isEmpty() || slots.size() > maxVariants) {
            throw new ValidationException("A fan-out needs between 1 and " + maxVariants + " styles, got "
                    + (slots == null ? 0 : slots.size()) + ".");
        }
        long startedAt = System.nanoTime();
        log.info("Fan-out for session {} step {} started: styles={}", sessionId, step.key(),
                slots.stream().map(StyleSlot::style).toList());

        if (providerIds.isEmpty()) {
            return CompletableFuture.completedFuture(allFallback(step, slots, REASON_NO_PROVIDERS, startedAt));
        }
        List<ImageProviderClient> usable = usableClients(sessionId, step);
        if (usable.isEmpty()) {
            log.warn("Fan-out for session {} step {} skipped: no provider client could be created", sessionId,
                    step.key());
            return CompletableFuture.completedFuture(allFallback(step, slots, REASON_CLIENT_UNAVAILABLE, startedAt));
        }
        List<ImageProviderClient> clients = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            clients.add(usable.get(i % usable.size()));
        }

        List<CompletableFuture<SlotOutcome>> futures = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            futures.add(runSlot(sessionId, step, i, slots.get(i), clients.get(i)));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        return all.completeOnTimeout(null, globalTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(ignored -> collect(sessionId, step, slots, clients, futures, startedAt));
    }

    private List<ImageProviderClient> usableClients(String sessionId, WorkflowStep step) {
        List<ImageProviderClient> usable = new ArrayList<>(providerIds.size());
        for (String providerId : providerIds) {
            try {
                usable.add(clientFactory.create(providerId));
            } catch (ProviderException ex) {
                log.warn("Provider {} left out of fan-out for session {} step {}: {}", providerId, sessionId,
                        step.key(), ex.getMessage());
            }
        }
        return usable;
    }

    private CompletableFuture<SlotOutcome> runSlot(String sessionId, WorkflowStep step, int index, StyleSlot slot,
                                                   ImageProviderClient client) {
        PromptSpec spec = PromptSpec.of(sessionId, step, slot.style(), slot.prompt());
        return client.generate(spec)
                .thenApplyAsync(result -> toOutcome(sessionId, step, index, slot, result), executor)
                .exceptionally(ex -> {
                    log.error("Slot {} ({}) of session {} failed unexpectedly", index, slot.style(), sessionId, ex);
                    GeneratedVariant fallback = fallbackCatalog.fallbackVariant(step, slot.style(), slot.prompt(),
                            REASON_UNEXPECTED, clock.instant());
                    return new SlotOutcome(index, slot.style(), client.providerId(), fallback, 0, REASON_UNEXPECTED, 0L);
                });
    }

    private SlotOutcome toOutcome(String sessionId, WorkflowStep step, int index, StyleSlot slot, ProviderResult result) {
        Instant now = clock.instant();
        if (!result.success()) {
            String errorType = result.errorType() != null ? result.errorType().value() : REASON_UNEXPECTED;
            GeneratedVariant fallback = fallbackCatalog.fallbackVariant(step, slot.style(), slot.prompt(), errorType, now);
            return new SlotOutcome(index, slot.style(), result.providerId(), fallback, result.attempts(), errorType,
                    result.latencyMs());
        }
        BlobReference blob = blobPersister.persist(sessionId, step, slot.style(), result.providerId(), result.imageUrl());
        GeneratedVariant variant = new GeneratedVariant(
                result.providerId(),
                slot.style(),
                result.sanitizedPrompt(),
                result.revisedPrompt(),
                blob,
                now,
                false,
                Map.of(META_ATTEMPTS, String.valueOf(result.attempts())));
        return new SlotOutcome(index, slot.style(), result.providerId(), variant, result.attempts(), null,
                result.latencyMs());
    }

    private FanOutResult collect(String sessionId, WorkflowStep step, List<StyleSlot> slots,
                                 List<ImageProviderClient> clients, List<CompletableFuture<SlotOutcome>> futures,
                                 long startedAt) {
        List<SlotOutcome> outcomes = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            SlotOutcome outcome = futures.get(i).getNow(null);
            if (outcome == null) {
                StyleSlot slot = slots.get(i);
                log.warn("Slot {} ({}) of session {} missed the {} ms deadline and was abandoned", i, slot.style(),
                        sessionId, globalTimeout.toMillis());
                GeneratedVariant fallback = fallbackCatalog.fallbackVariant(step, slot.style(), slot.prompt(),
                        REASON_DEADLINE, clock.instant());
                outcome = new SlotOutcome(i, slot.style(), clients.get(i).providerId(), fallback, 0, REASON_DEADLINE,
                        globalTimeout.toMillis());
            }
            outcomes.add(outcome);
        }
        FanOutResult result = new FanOutResult(step, outcomes, elapsedMs(startedAt), null);
        metricsService.recordFanOut(step.key(), slots.size(), result.fallbackCount(), result.elapsedMs());
        return result;
    }

    private FanOutResult allFallback(WorkflowStep step, List<StyleSlot> slots, String reason, long startedAt) {
        Instant now = clock.instant();
        List<SlotOutcome> outcomes = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            StyleSlot slot = slots.get(i);
            GeneratedVariant fallback = fallbackCatalog.fallbackVariant(step, slot.style(), slot.prompt(), reason, now);
            outcomes.add(new SlotOutcome(i, slot.style(), GenerationConstants.FALLBACK_PROVIDER_ID, fallback, 0,
                    reason, 0L));
        }
        FanOutResult result = new FanOutResult(step, outcomes, elapsedMs(startedAt), reason);
        metricsService.recordFanOut(step.key(), slots.size(), result.fallbackCount(), result.elapsedMs());
        return result;
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
