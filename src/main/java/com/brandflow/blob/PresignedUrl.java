package com.brandflow.blob;

import java.time.Instant;

public record PresignedUrl(String url, Instant expiresAt) {
}
