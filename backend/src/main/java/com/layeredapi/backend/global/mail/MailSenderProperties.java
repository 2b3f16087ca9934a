package com.layeredapi.backend.global.mail;

import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Sender identity for outgoing mail ({@code app.mail.*}). The SMTP connection itself is configured
 * under {@code spring.mail}.
 *
 * @param from     envelope and header sender address
 * @param fromName display name shown next to {@code from}
 */
@Validated
@ConfigurationProperties(prefix = "app.mail")
public record MailSenderProperties(
        @NotBlank @DefaultValue("no-reply@example.com") String from,
        @DefaultValue("Layered API") String fromName
) {
}
