package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties.ProviderConfig;
import com.brandflow.generation.GenerationMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Calls an OpenAI-compatible image generation endpoint ({@code POST /images/generations}).
 */
@Slf4j
public class HttpImageProviderClient extends AbstractImageProviderClient {

    static final String GENERATIONS_PATH = "/images/generations";

    private final RestClient restClient;

    public HttpImageProviderClient(String providerId,
                                   ProviderConfig config,
                                   RestClient restClient,
                                   PromptSanitizer sanitizer,
                                   Executor executor,
                                   GenerationMetricsService metricsService) {
        super(providerId, config, sanitizer, executor, metricsService);
        this.restClient = restClient;
    }

    @Override
    protected ProviderResponse invoke(String sanitizedPrompt, PromptSpec spec) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (StringUtils.hasText(config().getModel())) {
            body.put("model", config().getModel());
        }
        body.put("prompt", sanitizedPrompt);
        body.put("n", 1);
        body.put("size", spec.size() != null ? spec.size() : config().getSize());
        body.put("quality", spec.quality() != null ? spec.quality() : config().getQuality());

        JsonNode json;
        try {
            json = restClient.post()
                    .uri(GENERATIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            ProviderErrorType type = ProviderErrorType.fromStatus(ex.getStatusCode().value());
            throw new ProviderException(providerId(), type,
                    "HTTP " + ex.getStatusCode().value() + " from " + providerId(), ex);
        } catch (ResourceAccessException ex) {
            ProviderErrorType type = ex.getCause() instanceof SocketTimeoutException
                    ? ProviderErrorType.TIMEOUT
                    : ProviderErrorType.NETWORK_ERROR;
            throw new ProviderException(providerId(), type, "I/O failure calling " + providerId() + ": " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new ProviderException(providerId(), ProviderErrorType.SERVER_ERROR,
                    "Unreadable response from " + providerId() + ": " + ex.getMessage(), ex);
        }
        return parse(json);
    }

    private ProviderResponse parse(JsonNode json) {
        if (json == null) {
            throw new ProviderException(providerId(), ProviderErrorType.SERVER_ERROR, "Empty response body from " + providerId());
        }
        JsonNode item = json;
        JsonNode data = json.path("data");
        if (data.isArray() && !data.isEmpty()) {
            item = data.get(0);
        }
        String url = firstText(item, "imageUrl", "imageURL", "url");
        if (url == null) {
            url = firstText(json, "imageUrl", "imageURL", "url");
        }
        if (url == null) {
            throw new ProviderException(providerId(), ProviderErrorType.SERVER_ERROR,
                    "Response from " + providerId() + " carries no image URL");
        }
        String revised = firstText(item, "revisedPrompt", "revised_prompt");
        log.debug("Provider {} returned image {}", providerId(), url);
        return new ProviderResponse(url, revised);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && StringUtils.hasText(value.asText())) {
                return value.asText();
            }
        }
        return null;
    }
}
