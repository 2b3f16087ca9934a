package com.layeredapi.backend.modules.auth.infrastructure.jwt;

import java.time.Duration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * JWT signing settings ({@code jwt.*}).
 *
 * @param secret     HMAC secret; raw UTF-8 text, or base64 when prefixed with {@code base64:}
 * @param expiration token lifetime, e.g. {@code 24h}
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        @NotBlank String secret,
        @NotNull @DefaultValue("24h") Duration expiration
) {
}
