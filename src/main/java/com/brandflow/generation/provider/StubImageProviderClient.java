package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties.ProviderConfig;
import com.brandflow.generation.GenerationMetricsService;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.concurrent.Executor;

/**
 * Offline provider used for local runs: answers every prompt with the bundled placeholder
 * artwork, tagged with the provider and style that asked for it.
 */
public class StubImageProviderClient extends AbstractImageProviderClient {

    static final String PLACEHOLDER_PATH = "/stub/placeholder.svg";

    private final String publicBaseUrl;

    public StubImageProviderClient(String providerId,
                                   ProviderConfig config,
                                   String publicBaseUrl,
                                   PromptSanitizer sanitizer,
                                   Executor executor,
                                   GenerationMetricsService metricsService) {
        super(providerId, config, sanitizer, executor, metricsService);
        this.publicBaseUrl = publicBaseUrl;
    }

    @Override
    protected ProviderResponse invoke(String sanitizedPrompt, PromptSpec spec) {
        String url = UriComponentsBuilder.fromUriString(publicBaseUrl)
                .path(PLACEHOLDER_PATH)
                .queryParam("provider", providerId())
                .queryParam("style", spec.style())
                .queryParam("step", spec.step().key())
                .build()
                .toUriString();
        return new ProviderResponse(url, sanitizedPrompt);
    }
}
