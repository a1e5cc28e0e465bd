package com.brandflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.brandflow.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            long startedAt = System.nanoTime();
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(request, response, (System.nanoTime() - startedAt) / 1_000_000);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.info("--> {} {}", request.getMethod(), request.getURI());
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("Headers: {}", maskedHeaders(request.getHeaders()));
                if (body.length > 0) {
                    httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
                }
            }
        }

        private void logResponse(HttpRequest request, ClientHttpResponse response, long elapsedMs) throws IOException {
            httpLogger.info("<-- {} {} ({} ms)", response.getStatusCode().value(), request.getURI(), elapsedMs);
            if (httpLogger.isDebugEnabled() && isText(response.getHeaders().getContentType())) {
                byte[] body = StreamUtils.copyToByteArray(response.getBody());
                if (body.length > 0) {
                    httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
                }
            }
        }

        static HttpHeaders maskedHeaders(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "****");
            }
            return copy;
        }

        private static boolean isText(MediaType contentType) {
            return contentType != null && (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                    || "text".equals(contentType.getType()));
        }
    }
}
