package com.autobot.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * PUT /api/v1/mailboxes/{email} request body. A null password keeps the stored one; host, port and
 * tls fall back to the IMAP defaults when null.
 */
public record MailboxConfigRequest(
        String password,
        Boolean active,
        String host,

        @Min(value = 1, message = "INVALID_PORT")
        @Max(value = 65535, message = "INVALID_PORT")
        Integer port,

        String tls,

        @Valid
        List<ForwardRuleDto> forwardRules
) {
}
