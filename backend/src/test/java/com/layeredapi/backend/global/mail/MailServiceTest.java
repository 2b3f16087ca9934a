package com.layeredapi.backend.global.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class MailServiceTest {

    @Mock
    private JavaMailSender mailSender;

    private MailService mailService;

    @BeforeEach
    void setUp() {
        lenient().when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
        mailService = new MailService(mailSender, new MailSenderProperties("no-reply@example.com", "Layered API"));
    }

    @Test
    void sendSimpleDeliversPlainTextFromConfiguredSender() throws Exception {
        mailService.sendSimple("alice@example.com", "Welcome", "Hello Alice");

        MimeMessage sent = captureSent();
        InternetAddress from = (InternetAddress) sent.getFrom()[0];
        assertThat(from.getAddress()).isEqualTo("no-reply@example.com");
        assertThat(from.getPersonal()).isEqualTo("Layered API");
        assertThat(addresses(sent.getRecipients(Message.RecipientType.TO))).containsExactly("alice@example.com");
        assertThat(sent.getSubject()).isEqualTo("Welcome");
        assertThat(sent.getContent()).isEqualTo("Hello Alice");
        assertThat(sent.getDataHandler().getContentType()).startsWith("text/plain");
    }

    @Test
    void sendHtmlMarksBodyAsHtml() throws Exception {
        mailService.sendHtml("alice@example.com", "Welcome", "<p>Hello <b>Alice</b></p>");

        MimeMessage sent = captureSent();
        assertThat(sent.getContent()).isEqualTo("<p>Hello <b>Alice</b></p>");
        assertThat(sent.getDataHandler().getContentType()).startsWith("text/html");
    }

    @Test
    void sendAddsCopiesAndAttachments(@TempDir Path tempDir) throws Exception {
        Path report = Files.writeString(tempDir.resolve("report.txt"), "42 users");
        EmailMessage email = new EmailMessage(
                List.of("alice@example.com", "bob@example.com"),
                "Weekly report",
                "See attachment",
                false,
                List.of("carol@example.com"),
                List.of("audit@example.com"),
                List.of(report)
        );

        mailService.send(email);

        MimeMessage sent = captureSent();
        assertThat(addresses(sent.getRecipients(Message.RecipientType.TO)))
                .containsExactly("alice@example.com", "bob@example.com");
        assertThat(addresses(sent.getRecipients(Message.RecipientType.CC))).containsExactly("carol@example.com");
        assertThat(addresses(sent.getRecipients(Message.RecipientType.BCC))).containsExactly("audit@example.com");

        Multipart multipart = (Multipart) sent.getContent();
        assertThat(multipart.getCount()).isEqualTo(2);
        assertThat(multipart.getBodyPart(1).getDisposition()).isEqualTo(Part.ATTACHMENT);
        assertThat(multipart.getBodyPart(1).getFileName()).isEqualTo("report.txt");
    }

    @Test
    void deliveryFailureIsRethrown() {
        doThrow(new MailSendException("smtp down")).when(mailSender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> mailService.sendSimple("alice@example.com", "Welcome", "Hello"))
                .isInstanceOf(MailSendException.class);
    }

    @Test
    void messageWithoutRecipientsIsRejected() {
        assertThatThrownBy(() -> new EmailMessage(List.of(), "Subject", "Body", false, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private MimeMessage captureSent() {
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        return captor.getValue();
    }

    private static List<String> addresses(Address[] recipients) {
        return Arrays.stream(recipients)
                .map(address -> ((InternetAddress) address).getAddress())
                .toList();
    }
}
