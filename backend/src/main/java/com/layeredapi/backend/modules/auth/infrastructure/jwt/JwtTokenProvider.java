package com.layeredapi.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

/**
 * Holds the HMAC key derived from {@code jwt.secret}. Built once at startup and shared read-only.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String BASE64_PREFIX = "base64:";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(JwtProperties properties) {
        String secret = properties.secret();
        byte[] keyBytes;
        if (secret.startsWith(BASE64_PREFIX)) {
            try {
                keyBytes = Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("jwt.secret is not valid base64", ex);
            }
        } else {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        // HS256 needs a key of at least 256 bits
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_KEY_BYTES + " bytes long");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
