package com.brandflow.blob;

import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.workflow.model.BlobReference;
import com.brandflow.workflow.model.WorkflowStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Copies provider-hosted artifacts into the {@link BlobStore}. Failure to copy never
 * propagates: the caller gets the provider URL back, marked as provider-hosted and
 * time-limited.
 */
@Slf4j
public class BlobPersister {

    static final DateTimeFormatter KEY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    public static final String META_SESSION_ID = "session-id";
    public static final String META_STYLE = "style";
    public static final String META_PROVIDER = "provider";
    public static final String META_ORIGINAL_URL = "original-url";

    private final BlobStore blobStore;
    private final RestClient downloadClient;
    private final Duration providerUrlLifetime;
    private final GenerationMetricsService metricsService;
    private final Clock clock;

    public BlobPersister(BlobStore blobStore,
                         RestClient downloadClient,
                         Duration providerUrlLifetime,
                         GenerationMetricsService metricsService,
                         Clock clock) {
        this.blobStore = blobStore;
        this.downloadClient = downloadClient;
        this.providerUrlLifetime = providerUrlLifetime;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public BlobReference persist(String sessionId, WorkflowStep step, String style, String providerId, String sourceUrl) {
        Instant now = clock.instant();
        URI source;
        try {
            // presigned URLs arrive encoded and are sent as-is
            source = URI.create(sourceUrl);
        } catch (IllegalArgumentException | NullPointerException ex) {
            return degraded(sourceUrl, style, now, "invalid source url: " + ex.getMessage());
        }

        ResponseEntity<byte[]> download;
        try {
            download = downloadClient.get()
                    .uri(source)
                    .retrieve()
                    .toEntity(byte[].class);
        } catch (RuntimeException ex) {
            return degraded(sourceUrl, style, now, "download failed: " + ex.getMessage());
        }
        byte[] bytes = download.getBody();
        if (bytes == null || bytes.length == 0) {
            return degraded(sourceUrl, style, now, "empty download");
        }
        MediaType mediaType = download.getHeaders().getContentType();
        String contentType = mediaType != null ? mediaType.toString() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        String key = buildKey(step.key(), sessionId, style, now, mediaType);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(META_SESSION_ID, sessionId);
        metadata.put(META_STYLE, style);
        metadata.put(META_PROVIDER, providerId);
        metadata.put(META_ORIGINAL_URL, sourceUrl);

        BlobObject stored;
        try {
            stored = blobStore.put(key, bytes, contentType, metadata);
        } catch (RuntimeException ex) {
            return degraded(sourceUrl, style, now, "upload failed: " + ex.getMessage());
        }
        log.info("Persisted {} variant for session {} as {} ({} bytes)", style, sessionId, key, stored.size());
        return BlobReference.durable(stored.url(), stored.key(), stored.urlExpiresAt());
    }

    static String buildKey(String namespace, String sessionId, String style, Instant now, MediaType mediaType) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return namespace + "/" + sessionId + "/" + style + "_" + KEY_TIMESTAMP.format(now) + "_" + suffix
                + "." + extensionFor(mediaType);
    }

    static String extensionFor(MediaType mediaType) {
        if (mediaType == null) {
            return "bin";
        }
        String subtype = mediaType.getSubtype().toLowerCase(Locale.ROOT);
        return switch (subtype) {
            case "jpeg", "jpg", "pjpeg" -> "jpg";
            case "png" -> "png";
            case "webp" -> "webp";
            case "gif" -> "gif";
            case "svg+xml" -> "svg";
            default -> "bin";
        };
    }

    private BlobReference degraded(String sourceUrl, String style, Instant now, String reason) {
        log.warn("Keeping provider-hosted URL for {} variant, {}", style, reason);
        metricsService.recordDegradedPersist(style);
        return BlobReference.providerTransient(sourceUrl, now.plus(providerUrlLifetime), reason);
    }
}
