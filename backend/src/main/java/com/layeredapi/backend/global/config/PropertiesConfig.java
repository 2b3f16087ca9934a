package com.layeredapi.backend.global.config;

import com.layeredapi.backend.global.cache.CacheProperties;
import com.layeredapi.backend.global.mail.MailSenderProperties;
import com.layeredapi.backend.modules.auth.infrastructure.jwt.JwtProperties;
import com.layeredapi.backend.modules.user.application.SeedProperties;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the typed configuration records once at startup. Components receive them by injection.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({
        JwtProperties.class,
        CacheProperties.class,
        SeedProperties.class,
        MailSenderProperties.class
})
public class PropertiesConfig {
}
