package com.autobot.mail.adapter;

import com.autobot.mail.config.MailForwardProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Properties;

/**
 * Creates per-mailbox IMAP readers and SMTP senders authenticated as the mailbox itself.
 */
@Component
@RequiredArgsConstructor
public class MailTransportFactory {

    private final MailForwardProperties properties;
    private final Clock clock;

    public MailboxClient openReader(MailboxSettings settings) {
        requireCredentials(settings);
        return new ImapMailboxClient(settings, properties.getConnectTimeoutMs(), properties.getReadTimeoutMs(), clock);
    }

    public ForwardingMailSender openSender(MailboxSettings settings) {
        requireCredentials(settings);
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(properties.getSmtpHost());
        sender.setPort(properties.getSmtpPort());
        sender.setUsername(settings.email());
        sender.setPassword(settings.password());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());
        Properties javaMail = new Properties();
        javaMail.put("mail.smtp.auth", "true");
        if (properties.getSmtpPort() == 465) {
            javaMail.put("mail.smtp.ssl.enable", "true");
        } else {
            javaMail.put("mail.smtp.starttls.enable", "true");
        }
        javaMail.put("mail.smtp.connectiontimeout", String.valueOf(properties.getConnectTimeoutMs()));
        javaMail.put("mail.smtp.timeout", String.valueOf(properties.getReadTimeoutMs()));
        javaMail.put("mail.smtp.writetimeout", String.valueOf(properties.getReadTimeoutMs()));
        sender.setJavaMailProperties(javaMail);
        return new SmtpForwardingMailSender(sender);
    }

    private static void requireCredentials(MailboxSettings settings) {
        if (settings.email() == null || settings.email().isBlank()
                || settings.password() == null || settings.password().isBlank()) {
            throw new MailboxException("Mailbox " + settings.email() + " has no credentials configured");
        }
    }
}
