package com.brandflow.generation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class GenerationMetricsService {

    private final AtomicLong providerCallCount = new AtomicLong();
    private final AtomicLong retryCount = new AtomicLong();
    private final AtomicLong fanOutCount = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();
    private final AtomicLong degradedPersistCount = new AtomicLong();
    private final AtomicLong commitCount = new AtomicLong();

    public void recordProviderCall(String providerId, String style) {
        long count = providerCallCount.incrementAndGet();
        log.debug("Provider call #{} sent (provider={}, style={}).", count, providerId, style);
    }

    public void recordRetry(String providerId, String errorType) {
        long count = retryCount.incrementAndGet();
        log.debug("Provider retry #{} scheduled (provider={}, error={}).", count, providerId, errorType);
    }

    public void recordFanOut(String step, int requested, int fallbacks, long elapsedMs) {
        long runs = fanOutCount.incrementAndGet();
        long totalFallbacks = fallbackCount.addAndGet(fallbacks);
        log.info("Fan-out #{} for {} finished in {} ms: {} requested, {} fallbacks. Total fallbacks={}.",
                runs, step, elapsedMs, requested, fallbacks, totalFallbacks);
    }

    public void recordDegradedPersist(String style) {
        long count = degradedPersistCount.incrementAndGet();
        log.debug("Variant {} kept a provider-hosted reference. Total degraded={}.", style, count);
    }

    public void recordCommit(String step) {
        long count = commitCount.incrementAndGet();
        log.debug("Session commit #{} ({}).", count, step);
    }

    public void logSummary() {
        log.info("Generation stats: providerCalls={}, retries={}, fanOuts={}, fallbacks={}, degradedPersists={}, commits={}.",
                providerCallCount.get(), retryCount.get(), fanOutCount.get(), fallbackCount.get(),
                degradedPersistCount.get(), commitCount.get());
    }
}
