package com.layeredapi.backend.global.mail;

import java.nio.file.Path;
import java.util.List;

/**
 * One outgoing email. Attachments are files on local disk, attached under their file name.
 */
public record EmailMessage(
        List<String> to,
        String subject,
        String body,
        boolean html,
        List<String> cc,
        List<String> bcc,
        List<Path> attachments
) {

    public EmailMessage {
        if (to == null || to.isEmpty()) {
            throw new IllegalArgumentException("EmailMessage needs at least one recipient");
        }
        to = List.copyOf(to);
        cc = cc != null ? List.copyOf(cc) : List.of();
        bcc = bcc != null ? List.copyOf(bcc) : List.of();
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public static EmailMessage text(String to, String subject, String body) {
        return new EmailMessage(List.of(to), subject, body, false, null, null, null);
    }

    public static EmailMessage html(String to, String subject, String htmlBody) {
        return new EmailMessage(List.of(to), subject, htmlBody, true, null, null, null);
    }
}
