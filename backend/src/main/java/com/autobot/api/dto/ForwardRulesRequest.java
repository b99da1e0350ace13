package com.autobot.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * PUT /api/v1/mailboxes/{email}/rules request body. An empty list clears the rules.
 */
public record ForwardRulesRequest(
        @NotNull(message = "INVALID_RULE")
        @Valid
        List<ForwardRuleDto> forwardRules
) {
}
