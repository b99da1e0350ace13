package com.autobot.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ForwardRuleDto(
        @NotBlank(message = "INVALID_RULE")
        String subjectSearch,

        @NotBlank(message = "INVALID_RULE")
        String destinationEmail
) {
}
