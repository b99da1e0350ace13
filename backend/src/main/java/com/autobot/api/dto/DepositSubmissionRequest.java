package com.autobot.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/deposits request body.
 */
public record DepositSubmissionRequest(
        @NotBlank(message = "INVALID_CHAIN_ID")
        String chainId,

        @NotBlank(message = "INVALID_TX_HASH")
        String txHash,

        @NotBlank(message = "INVALID_TX_NONCE")
        String txNonce
) {
}
