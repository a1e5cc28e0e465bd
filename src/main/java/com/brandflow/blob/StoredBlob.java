package com.brandflow.blob;

import java.time.Instant;
import java.util.Map;

public record StoredBlob(
        String key,
        byte[] bytes,
        String contentType,
        Map<String, String> metadata,
        Instant lastModified
) {
}
