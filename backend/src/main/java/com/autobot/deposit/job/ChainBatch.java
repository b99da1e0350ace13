package com.autobot.deposit.job;

import com.autobot.deposit.adapter.ChainAdapter;
import com.autobot.domain.ConfirmationRecord;

import java.util.List;

/**
 * Pending deposits of one supported chain, with the adapter serving it.
 */
public record ChainBatch(String chainId, ChainAdapter adapter, List<ConfirmationRecord> records) {

    public ChainBatch {
        records = List.copyOf(records);
    }
}
