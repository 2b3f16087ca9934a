package com.layeredapi.backend.global.mail;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

/**
 * Sends mail over the SMTP server configured under {@code spring.mail}. Delivery is synchronous;
 * failures are logged and rethrown as {@link MailException}.
 */
@Service
public class MailService {

    private static final Logger log = LoggerFactory.getLogger(MailService.class);

    private final JavaMailSender mailSender;
    private final MailSenderProperties properties;

    public MailService(JavaMailSender mailSender, MailSenderProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    public void send(EmailMessage email) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            boolean multipart = !email.attachments().isEmpty();
            MimeMessageHelper helper = new MimeMessageHelper(message, multipart, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.from(), properties.fromName());
            helper.setTo(email.to().toArray(String[]::new));
            if (!email.cc().isEmpty()) {
                helper.setCc(email.cc().toArray(String[]::new));
            }
            if (!email.bcc().isEmpty()) {
                helper.setBcc(email.bcc().toArray(String[]::new));
            }
            helper.setSubject(email.subject());
            helper.setText(email.body(), email.html());
            for (Path attachment : email.attachments()) {
                helper.addAttachment(attachment.getFileName().toString(), new FileSystemResource(attachment));
            }
        } catch (MessagingException | UnsupportedEncodingException ex) {
            log.error("Failed to build email to {}: {}", email.to(), ex.getMessage());
            throw new MailPreparationException("Could not build email", ex);
        }

        try {
            mailSender.send(message);
        } catch (MailException ex) {
            log.error("Failed to send email to {}: {}", email.to(), ex.getMessage());
            throw ex;
        }
        log.info("Email sent successfully to: {}", email.to());
    }

    public void sendSimple(String to, String subject, String body) {
        send(EmailMessage.text(to, subject, body));
    }

    public void sendHtml(String to, String subject, String htmlBody) {
        send(EmailMessage.html(to, subject, htmlBody));
    }
}
