package com.autobot.mail.job;

import com.autobot.domain.ForwardRule;
import com.autobot.mail.adapter.ForwardingMailSender;
import com.autobot.mail.adapter.MailMessage;
import com.autobot.mail.adapter.MailTransportFactory;
import com.autobot.mail.adapter.MailboxClient;
import com.autobot.mail.adapter.MailboxSettings;
import com.autobot.mail.config.MailForwardProperties;
import com.autobot.mail.store.MailboxConfigService;
import com.autobot.polling.IncrementalPoller;
import com.autobot.polling.ProgressTracker;
import com.autobot.polling.WatermarkStore;
import com.autobot.polling.WatermarkTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Forwards new messages of every active mailbox according to its forward rules. The mailbox watermark
 * is the date of the last message handled; older or equal messages are never forwarded again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailForwardPoller extends IncrementalPoller<MailboxSettings, MailMessage> {

    private final MailboxConfigService mailboxConfigService;
    private final WatermarkStore watermarkStore;
    private final MailTransportFactory transportFactory;
    private final MailForwardProperties properties;

    @Override
    protected String name() {
        return MailForwardJob.JOB_ID;
    }

    @Override
    protected List<MailboxSettings> listEntities() {
        return mailboxConfigService.listActive();
    }

    @Override
    protected String entityId(MailboxSettings mailbox) {
        return mailbox.email();
    }

    @Override
    protected ProgressTracker<MailMessage> openTracker(MailboxSettings mailbox) {
        Instant lastRead = watermarkStore.get(mailbox.email()).orElse(null);
        return new WatermarkTracker<>(mailbox.email(), lastRead, MailMessage::date, watermarkStore::advance);
    }

    @Override
    protected List<MailMessage> fetchCandidates(MailboxSettings mailbox) {
        List<MailMessage> messages = new ArrayList<>();
        try (MailboxClient client = transportFactory.openReader(mailbox)) {
            client.connect();
            List<String> ids = client.listRecentMessageIds(properties.getRecentMessageLimit());
            for (String id : ids) {
                try {
                    messages.add(client.fetchMessage(id));
                } catch (RuntimeException e) {
                    // Ids are oldest first: later messages wait too, so the watermark stays below this one.
                    log.warn("{}: failed to fetch message {} for {}, deferring it and {} newer message(s): {}",
                            name(), id, mailbox.email(), ids.size() - messages.size() - 1, e.getMessage(), e);
                    break;
                }
            }
        }
        return messages;
    }

    @Override
    protected String itemId(MailMessage message) {
        return message.id();
    }

    @Override
    protected void process(MailboxSettings mailbox, MailMessage message) {
        log.info("{}: processing message {} '{}' ({}) for {}",
                name(), message.id(), message.subject(), message.date(), mailbox.email());
        ForwardingMailSender sender = null;
        for (ForwardRule rule : mailbox.forwardRules()) {
            if (!ForwardRuleMatcher.matchesSubject(message.subject(), rule.getSubjectSearch())) {
                continue;
            }
            log.info("{}: subject matches rule '{}'", name(), rule.getSubjectSearch());
            if (!ForwardRuleMatcher.isValidEmail(rule.getDestinationEmail())) {
                log.warn("{}: invalid destination email '{}' in rule '{}' for {}, rule skipped",
                        name(), rule.getDestinationEmail(), rule.getSubjectSearch(), mailbox.email());
                continue;
            }
            if (sender == null) {
                sender = transportFactory.openSender(mailbox);
            }
            sender.send(
                    mailbox.email(),
                    rule.getDestinationEmail(),
                    ForwardRuleMatcher.forwardSubject(message.subject()),
                    ForwardRuleMatcher.formatForwardBody(message.body(), message.from(), message.subject()));
            log.info("{}: message {} forwarded to {}", name(), message.id(), rule.getDestinationEmail());
        }
    }
}
