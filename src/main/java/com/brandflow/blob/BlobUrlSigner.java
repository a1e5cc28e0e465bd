package com.brandflow.blob;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Issues and verifies time-bounded read URLs of the form
 * {@code {base}/api/blobs/{key}?expires=<epochSeconds>&signature=<hex HMAC-SHA256(key|expires)>}.
 */
@Slf4j
public class BlobUrlSigner {

    static final String ALGORITHM = "HmacSHA256";
    public static final String READ_PATH = "/api/blobs/";

    private final byte[] signingKey;
    private final String publicBaseUrl;

    public BlobUrlSigner(String signingKey, String publicBaseUrl) {
        if (StringUtils.hasText(signingKey)) {
            this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        } else {
            log.warn("brandflow.blob.signing-key is not set; read URLs are signed with a random key and expire on restart.");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            this.signingKey = random;
        }
        this.publicBaseUrl = publicBaseUrl == null ? "" : publicBaseUrl.replaceAll("/+$", "");
    }

    public PresignedUrl presign(String key, Instant now, Duration ttl) {
        Instant expiresAt = now.plus(ttl);
        long expires = expiresAt.getEpochSecond();
        String url = UriComponentsBuilder.fromUriString(publicBaseUrl + READ_PATH + key)
                .queryParam("expires", expires)
                .queryParam("signature", sign(key, expires))
                .build()
                .toUriString();
        return new PresignedUrl(url, Instant.ofEpochSecond(expires));
    }

    public boolean verify(String key, long expires, String signature, Instant now) {
        if (!StringUtils.hasText(signature) || now.getEpochSecond() > expires) {
            return false;
        }
        byte[] expected = sign(key, expires).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    String sign(String key, long expires) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, ALGORITHM));
            byte[] digest = mac.doFinal((key + "|" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 is not available", ex);
        }
    }
}
