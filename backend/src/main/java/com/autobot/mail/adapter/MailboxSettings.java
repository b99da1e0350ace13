package com.autobot.mail.adapter;

import com.autobot.domain.ForwardRule;

import java.util.List;

/**
 * Fully populated mailbox settings: every default already applied.
 */
public record MailboxSettings(
        String email,
        String password,
        String host,
        int port,
        TlsMode tls,
        List<ForwardRule> forwardRules
) {

    public MailboxSettings {
        forwardRules = List.copyOf(forwardRules);
    }

    @Override
    public String toString() {
        return "MailboxSettings[" + email + " " + host + ":" + port + " " + tls + " rules=" + forwardRules.size() + "]";
    }
}
