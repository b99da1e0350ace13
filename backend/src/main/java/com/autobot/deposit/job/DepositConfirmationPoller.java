package com.autobot.deposit.job;

import com.autobot.deposit.adapter.ChainAdapter;
import com.autobot.deposit.adapter.ChainAdapterRegistry;
import com.autobot.deposit.adapter.ConfirmationRequirementClient;
import com.autobot.deposit.adapter.DepositSubmitter;
import com.autobot.deposit.store.DepositRecordStore;
import com.autobot.domain.ConfirmationRecord;
import com.autobot.polling.IncrementalPoller;
import com.autobot.polling.ProgressTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks pending deposits chain by chain: learns each transaction's block height, then submits and
 * deletes the record once the chain has produced enough confirmations. Progress lives in the records,
 * so every pending record is a candidate on every pass.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DepositConfirmationPoller extends IncrementalPoller<ChainBatch, PendingDeposit> {

    private final DepositRecordStore recordStore;
    private final ChainAdapterRegistry chainAdapters;
    private final ConfirmationRequirementClient requirementClient;
    private final DepositSubmitter submitter;

    @Override
    protected String name() {
        return DepositConfirmationJob.JOB_ID;
    }

    @Override
    protected List<ChainBatch> listEntities() {
        List<ChainBatch> batches = new ArrayList<>();
        for (Map.Entry<String, List<ConfirmationRecord>> entry : recordStore.listPendingByChain().entrySet()) {
            ChainAdapter adapter = chainAdapters.find(entry.getKey()).orElse(null);
            if (adapter == null) {
                log.warn("{}: chain {} not supported (configured: {}), {} deposit(s) left pending",
                        name(), entry.getKey(), chainAdapters.supportedChainIds(), entry.getValue().size());
                continue;
            }
            batches.add(new ChainBatch(entry.getKey(), adapter, entry.getValue()));
        }
        return batches;
    }

    @Override
    protected String entityId(ChainBatch batch) {
        return "chain " + batch.chainId();
    }

    @Override
    protected ProgressTracker<PendingDeposit> openTracker(ChainBatch batch) {
        return ProgressTracker.acceptAll();
    }

    @Override
    protected List<PendingDeposit> fetchCandidates(ChainBatch batch) {
        log.info("{}: processing {} deposit(s) for chain {}", name(), batch.records().size(), batch.chainId());
        long chainHeight = batch.adapter().getChainHeight();
        int required = requirementClient.requiredConfirmations(batch.chainId());
        log.debug("{}: chain {} at height {}, {} confirmation(s) required",
                name(), batch.chainId(), chainHeight, required);
        List<PendingDeposit> candidates = new ArrayList<>(batch.records().size());
        for (ConfirmationRecord record : batch.records()) {
            candidates.add(new PendingDeposit(record, chainHeight, required));
        }
        return candidates;
    }

    @Override
    protected String itemId(PendingDeposit deposit) {
        return deposit.record().getTxHash();
    }

    @Override
    protected void process(ChainBatch batch, PendingDeposit deposit) {
        ConfirmationRecord record = deposit.record();
        if (!record.isHeightKnown()) {
            long txHeight = batch.adapter().getTxHeight(record.getTxHash());
            if (txHeight <= 0) {
                log.debug("{}: {} not yet in a block", name(), record.getTxHash());
                return;
            }
            record = recordStore.recordHeight(record, txHeight);
            log.info("{}: {} included at height {}", name(), record.getTxHash(), txHeight);
        }
        if (!isConfirmed(record.getConfirmedHeight(), deposit.requiredConfirmations(), deposit.chainHeight())) {
            return;
        }
        DepositSubmitter.SubmitOutcome outcome =
                submitter.submit(record.getChainId(), record.getTxHash(), record.getTxNonce());
        log.info("{}: deposit {} submitted ({})", name(), record.getTxHash(), outcome);
        recordStore.delete(record);
    }

    /**
     * The block at {@code confirmedHeight} counts as the first confirmation.
     */
    static boolean isConfirmed(long confirmedHeight, int requiredConfirmations, long chainHeight) {
        return confirmedHeight > 0 && confirmedHeight + (requiredConfirmations - 1L) <= chainHeight;
    }
}
