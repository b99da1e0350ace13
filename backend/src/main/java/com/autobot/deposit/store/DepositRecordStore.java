package com.autobot.deposit.store;

import com.autobot.domain.ConfirmationRecord;
import com.autobot.domain.ConfirmationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle of pending deposits: register on intake, record the block height, delete after submit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositRecordStore {

    private final ConfirmationRecordRepository repository;
    private final Clock clock;

    /**
     * Creates a pending record with {@code confirmedHeight=0}. Registering the same chain/hash again
     * returns the existing record unchanged.
     */
    public ConfirmationRecord register(String chainId, String txHash, String txNonce) {
        String id = ConfirmationRecord.idOf(chainId, txHash);
        Optional<ConfirmationRecord> existing = repository.findById(id);
        if (existing.isPresent()) {
            log.info("Deposit {} already registered", id);
            return existing.get();
        }
        Instant now = clock.instant();
        ConfirmationRecord record = new ConfirmationRecord();
        record.setId(id);
        record.setChainId(chainId);
        record.setTxHash(txHash);
        record.setTxNonce(txNonce);
        record.setConfirmedHeight(0L);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        ConfirmationRecord saved = repository.save(record);
        log.info("Registered deposit {} (nonce {})", id, txNonce);
        return saved;
    }

    /** Pending records grouped by chain id, oldest first within each chain. */
    public Map<String, List<ConfirmationRecord>> listPendingByChain() {
        Map<String, List<ConfirmationRecord>> byChain = new LinkedHashMap<>();
        for (ConfirmationRecord record : repository.findAllByOrderByCreatedAtAsc()) {
            if (record.getChainId() == null || record.getTxHash() == null) {
                log.warn("Skipping malformed deposit record {}", record.getId());
                continue;
            }
            byChain.computeIfAbsent(record.getChainId(), k -> new ArrayList<>()).add(record);
        }
        return byChain;
    }

    public ConfirmationRecord recordHeight(ConfirmationRecord record, long height) {
        record.setConfirmedHeight(height);
        record.setUpdatedAt(clock.instant());
        return repository.save(record);
    }

    public void delete(ConfirmationRecord record) {
        repository.deleteById(record.getId());
    }
}
