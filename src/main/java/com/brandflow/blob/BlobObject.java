package com.brandflow.blob;

import java.time.Instant;

public record BlobObject(
        String key,
        String url,
        Instant urlExpiresAt,
        long size,
        String contentType
) {
}
