package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.generation.GenerationMetricsService;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

public class StubImageProviderClientFactory implements ImageProviderClientFactory {

    private final BrandFlowProperties properties;
    private final PromptSanitizer sanitizer;
    private final Executor executor;
    private final GenerationMetricsService metricsService;
    private final Map<String, ImageProviderClient> clients = new ConcurrentHashMap<>();

    public StubImageProviderClientFactory(BrandFlowProperties properties,
                                          PromptSanitizer sanitizer,
                                          Executor executor,
                                          GenerationMetricsService metricsService) {
        this.properties = properties;
        this.sanitizer = sanitizer;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    @Override
    public ImageProviderClient create(String providerId) {
        return clients.computeIfAbsent(providerId, id -> new StubImageProviderClient(id,
                properties.getProviderConfig(id), properties.getBlob().getPublicBaseUrl(),
                sanitizer, executor, metricsService));
    }
}
