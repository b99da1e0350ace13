package com.autobot.deposit.job;

import com.autobot.domain.ConfirmationRecord;

/**
 * A pending record paired with the chain state read once at the start of its chain's batch.
 */
public record PendingDeposit(ConfirmationRecord record, long chainHeight, int requiredConfirmations) {
}
