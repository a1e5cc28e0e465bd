package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.config.BrandFlowProperties.ProviderConfig;
import com.brandflow.generation.GenerationMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Builds one {@link HttpImageProviderClient} per configured provider and reuses it.
 * Credentials are checked here, so a provider without a key never gets a client.
 */
@Slf4j
public class HttpImageProviderClientFactory implements ImageProviderClientFactory {

    private final BrandFlowProperties properties;
    private final RestClient.Builder restClientBuilder;
    private final PromptSanitizer sanitizer;
    private final Executor executor;
    private final GenerationMetricsService metricsService;
    private final Map<String, ImageProviderClient> clients = new ConcurrentHashMap<>();

    public HttpImageProviderClientFactory(BrandFlowProperties properties,
                                          RestClient.Builder restClientBuilder,
                                          PromptSanitizer sanitizer,
                                          Executor executor,
                                          GenerationMetricsService metricsService) {
        this.properties = properties;
        this.restClientBuilder = restClientBuilder;
        this.sanitizer = sanitizer;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    @Override
    public ImageProviderClient create(String providerId) {
        ImageProviderClient cached = clients.get(providerId);
        if (cached != null) {
            return cached;
        }
        ProviderConfig config = properties.getGeneration().getProviders().get(providerId);
        if (config == null) {
            throw ProviderException.missingCredentials(providerId, "no configuration under brandflow.generation.providers");
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            throw ProviderException.missingCredentials(providerId, "api-key is not set");
        }
        if (!StringUtils.hasText(config.getBaseUrl())) {
            throw ProviderException.missingCredentials(providerId, "base-url is not set");
        }
        return clients.computeIfAbsent(providerId, id -> {
            log.info("Creating HTTP image client for provider {} at {}", id, config.getBaseUrl());
            return new HttpImageProviderClient(id, config, buildRestClient(config), sanitizer, executor, metricsService);
        });
    }

    private RestClient buildRestClient(ProviderConfig config) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) config.getAttemptTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return restClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .requestFactory(new BufferingClientHttpRequestFactory(requestFactory))
                .build();
    }
}
