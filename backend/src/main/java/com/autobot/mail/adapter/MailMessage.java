package com.autobot.mail.adapter;

import java.time.Instant;

/**
 * Parsed message. {@code date} is the ordering key for the mailbox watermark.
 */
public record MailMessage(String id, String subject, String from, String to, String body, Instant date) {
}
