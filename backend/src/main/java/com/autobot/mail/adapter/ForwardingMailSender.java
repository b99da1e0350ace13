package com.autobot.mail.adapter;

/**
 * Send side of a mailbox. Blocks until the message is handed to the server or fails.
 */
public interface ForwardingMailSender {

    void send(String from, String to, String subject, String body);
}
