package com.autobot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for mailbox configurations. Used by MailboxConfigService.
 */
public interface MailboxConfigRepository extends MongoRepository<MailboxConfig, String> {

    List<MailboxConfig> findByActiveTrue();
}
