package com.layeredapi.backend.global.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param enabled whether the Redis client is used at all; connection settings live under {@code spring.data.redis}
 */
@ConfigurationProperties(prefix = "app.cache")
public record CacheProperties(@DefaultValue("false") boolean enabled) {
}
