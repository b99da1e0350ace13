package com.autobot.mail.adapter;

/**
 * Thrown when a mailbox cannot be opened or read, or lacks credentials.
 */
public class MailboxException extends RuntimeException {

    public MailboxException(String message) {
        super(message);
    }

    public MailboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
