package com.autobot.mail.store;

import com.autobot.domain.ForwardRule;
import com.autobot.domain.MailboxConfig;
import com.autobot.domain.MailboxConfigRepository;
import com.autobot.mail.adapter.MailboxSettings;
import com.autobot.mail.adapter.TlsMode;
import com.autobot.mail.config.MailForwardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mailbox configurations: CRUD for the admin API, and the active set for the forwarder with every
 * optional field defaulted. Edits are picked up by the next forwarder pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MailboxConfigService {

    private final MailboxConfigRepository repository;
    private final MailForwardProperties properties;
    private final Clock clock;

    public List<MailboxSettings> listActive() {
        List<MailboxSettings> active = new ArrayList<>();
        for (MailboxConfig config : repository.findByActiveTrue()) {
            if (config.getEmail() == null || config.getEmail().isBlank()) {
                log.warn("Skipping mailbox config without email address");
                continue;
            }
            if (config.getForwardRules().isEmpty()) {
                log.debug("Skipping mailbox {} without forward rules", config.getEmail());
                continue;
            }
            active.add(toSettings(config));
        }
        return active;
    }

    public MailboxSettings toSettings(MailboxConfig config) {
        List<ForwardRule> rules = new ArrayList<>();
        for (ForwardRule rule : config.getForwardRules()) {
            if (rule != null) {
                rules.add(rule);
            }
        }
        return new MailboxSettings(
                config.getEmail(),
                config.getPassword(),
                isBlank(config.getHost()) ? properties.getDefaultImapHost() : config.getHost(),
                config.getPort() != null ? config.getPort() : properties.getDefaultImapPort(),
                TlsMode.parse(isBlank(config.getTls()) ? properties.getDefaultTls() : config.getTls()),
                rules);
    }

    public List<MailboxConfig> findAll() {
        return repository.findAll();
    }

    public Optional<MailboxConfig> findByEmail(String email) {
        return repository.findById(email);
    }

    /**
     * Creates or replaces the configuration stored under {@code email}.
     */
    public MailboxConfig save(String email, MailboxConfig config) {
        config.setEmail(email);
        config.setUpdatedAt(clock.instant());
        MailboxConfig saved = repository.save(config);
        log.info("Saved mailbox config for {} ({} rule(s), active={})",
                email, saved.getForwardRules().size(), saved.getActive());
        return saved;
    }

    /**
     * Replaces only the forward rules of an existing configuration.
     *
     * @return the updated configuration, or empty if none is stored under {@code email}
     */
    public Optional<MailboxConfig> updateRules(String email, List<ForwardRule> rules) {
        return repository.findById(email).map(config -> {
            config.setForwardRules(new ArrayList<>(rules));
            config.setUpdatedAt(clock.instant());
            MailboxConfig saved = repository.save(config);
            log.info("Updated forward rules for {} ({} rule(s))", email, saved.getForwardRules().size());
            return saved;
        });
    }

    /**
     * @return false if no configuration was stored under {@code email}
     */
    public boolean delete(String email) {
        if (!repository.existsById(email)) {
            return false;
        }
        repository.deleteById(email);
        log.info("Deleted mailbox config for {}", email);
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
