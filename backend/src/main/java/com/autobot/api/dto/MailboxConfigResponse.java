package com.autobot.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Mailbox configuration as returned by the API. The password is never included.
 */
public record MailboxConfigResponse(
        String email,
        Boolean active,
        String host,
        Integer port,
        String tls,
        List<ForwardRuleDto> forwardRules,
        Instant updatedAt
) {
}
