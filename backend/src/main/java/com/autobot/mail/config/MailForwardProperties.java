package com.autobot.mail.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Mail forwarder config: message window, defaults for optional mailbox fields, transport timeouts.
 */
@ConfigurationProperties(prefix = "autobot.mail")
@NoArgsConstructor
@Getter
@Setter
public class MailForwardProperties {

    /** Most recent messages inspected per mailbox per pass. */
    private int recentMessageLimit = 30;

    private String defaultImapHost = "imap.gmail.com";
    private int defaultImapPort = 993;
    /** "implicit" = TLS on connect (IMAPS). */
    private String defaultTls = "implicit";

    private String smtpHost = "smtp.gmail.com";
    private int smtpPort = 465;

    private int connectTimeoutMs = 60_000;
    private int readTimeoutMs = 60_000;
}
