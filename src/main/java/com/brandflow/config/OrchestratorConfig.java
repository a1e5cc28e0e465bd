package com.brandflow.config;

import com.brandflow.blob.BlobPersister;
import com.brandflow.blob.BlobStore;
import com.brandflow.blob.BlobUrlSigner;
import com.brandflow.blob.FileSystemBlobStore;
import com.brandflow.generation.FallbackCatalog;
import com.brandflow.generation.FanOutOrchestrator;
import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.generation.StyleCatalog;
import com.brandflow.generation.VisualPromptBuilder;
import com.brandflow.generation.provider.HttpImageProviderClientFactory;
import com.brandflow.generation.provider.ImageProviderClientFactory;
import com.brandflow.generation.provider.PromptSanitizer;
import com.brandflow.generation.provider.StubImageProviderClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
@Slf4j
public class OrchestratorConfig {

    private final BrandFlowProperties properties;

    public OrchestratorConfig(BrandFlowProperties properties) {
        List<String> problems = properties.validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid brandflow configuration: " + String.join("; ", problems));
        }
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor() {
        return Executors.newFixedThreadPool(properties.getGeneration().getWorkerConcurrency());
    }

    @Bean
    public PromptSanitizer promptSanitizer() {
        return new PromptSanitizer(properties.getGeneration().getDenyList(),
                properties.getGeneration().getSafetyQualifier());
    }

    @Bean
    public ImageProviderClientFactory imageProviderClientFactory(RestClient.Builder restClientBuilder,
                                                                 PromptSanitizer promptSanitizer,
                                                                 @Qualifier("workerExecutor") ExecutorService workerExecutor,
                                                                 GenerationMetricsService metricsService) {
        BrandFlowProperties.ProviderMode mode = properties.getGeneration().getProviderMode();
        log.info("Image providers run in {} mode: {}", mode, properties.getGeneration().getProviders().keySet());
        return switch (mode) {
            case HTTP -> new HttpImageProviderClientFactory(properties, restClientBuilder, promptSanitizer,
                    workerExecutor, metricsService);
            case STUB -> new StubImageProviderClientFactory(properties, promptSanitizer, workerExecutor, metricsService);
        };
    }

    @Bean
    public BlobUrlSigner blobUrlSigner() {
        return new BlobUrlSigner(properties.getBlob().getSigningKey(), properties.getBlob().getPublicBaseUrl());
    }

    @Bean
    public BlobStore blobStore(BlobUrlSigner blobUrlSigner, ObjectMapper objectMapper, Clock clock) {
        return new FileSystemBlobStore(properties.getBlob().getRoot(), blobUrlSigner,
                properties.getBlob().getReadUrlTtl(), objectMapper, clock);
    }

    @Bean
    public BlobPersister blobPersister(BlobStore blobStore,
                                       RestClient.Builder restClientBuilder,
                                       GenerationMetricsService metricsService,
                                       Clock clock) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.getBlob().getDownloadTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        RestClient downloadClient = restClientBuilder.requestFactory(requestFactory).build();
        return new BlobPersister(blobStore, downloadClient, properties.getBlob().getProviderUrlLifetime(),
                metricsService, clock);
    }

    @Bean
    public StyleCatalog styleCatalog() {
        return new StyleCatalog(properties.getGeneration().getMaxVariants());
    }

    @Bean
    public FallbackCatalog fallbackCatalog() {
        return new FallbackCatalog(properties.getGeneration().getFallbacks(),
                properties.getGeneration().getFallbackBaseUrl());
    }

    @Bean
    public VisualPromptBuilder visualPromptBuilder() {
        return new VisualPromptBuilder();
    }

    @Bean
    public FanOutOrchestrator fanOutOrchestrator(ImageProviderClientFactory imageProviderClientFactory,
                                                 BlobPersister blobPersister,
                                                 FallbackCatalog fallbackCatalog,
                                                 GenerationMetricsService metricsService,
                                                 @Qualifier("workerExecutor") ExecutorService workerExecutor,
                                                 Clock clock) {
        return new FanOutOrchestrator(imageProviderClientFactory,
                new ArrayList<>(properties.getGeneration().getProviders().keySet()),
                blobPersister, fallbackCatalog, metricsService, workerExecutor,
                properties.getGeneration().getGlobalTimeout(), properties.getGeneration().getMaxVariants(), clock);
    }
}
