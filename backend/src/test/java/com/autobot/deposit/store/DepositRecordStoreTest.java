package com.autobot.deposit.store;

import com.autobot.domain.ConfirmationRecord;
import com.autobot.domain.ConfirmationRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DepositRecordStoreTest {

    private static final Instant NOW = Instant.parse("2025-05-05T05:05:05Z");

    @Mock
    ConfirmationRecordRepository repository;

    DepositRecordStore store;

    @BeforeEach
    void setUp() {
        store = new DepositRecordStore(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void register_new_createsPendingRecord() {
        when(repository.findById("0_aa11")).thenReturn(Optional.empty());
        when(repository.save(any(ConfirmationRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ConfirmationRecord record = store.register("0", "aa11", "4");

        assertThat(record.getId()).isEqualTo("0_aa11");
        assertThat(record.getConfirmedHeight()).isZero();
        assertThat(record.isHeightKnown()).isFalse();
        assertThat(record.getTxNonce()).isEqualTo("4");
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("registering the same deposit twice keeps the existing record")
    void register_existing_unchanged() {
        ConfirmationRecord existing = new ConfirmationRecord();
        existing.setId("0_aa11");
        existing.setConfirmedHeight(100);
        when(repository.findById("0_aa11")).thenReturn(Optional.of(existing));

        assertThat(store.register("0", "aa11", "4")).isSameAs(existing);
        verify(repository, never()).save(any());
    }

    @Test
    void listPendingByChain_groupsAndDropsMalformed() {
        ConfirmationRecord a = record("0", "aa11");
        ConfirmationRecord b = record("2", "bb22");
        ConfirmationRecord c = record("0", "cc33");
        ConfirmationRecord broken = record(null, "dd44");
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(a, b, broken, c));

        Map<String, List<ConfirmationRecord>> byChain = store.listPendingByChain();

        assertThat(byChain).containsOnlyKeys("0", "2");
        assertThat(byChain.get("0")).containsExactly(a, c);
        assertThat(byChain.get("2")).containsExactly(b);
    }

    @Test
    void recordHeight_updatesHeightAndTimestamp() {
        ConfirmationRecord record = record("0", "aa11");
        when(repository.save(record)).thenReturn(record);

        store.recordHeight(record, 881200L);

        assertThat(record.getConfirmedHeight()).isEqualTo(881200L);
        assertThat(record.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void delete_byId() {
        store.delete(record("0", "aa11"));

        verify(repository).deleteById("0_aa11");
    }

    private static ConfirmationRecord record(String chainId, String txHash) {
        ConfirmationRecord record = new ConfirmationRecord();
        record.setId(ConfirmationRecord.idOf(chainId, txHash));
        record.setChainId(chainId);
        record.setTxHash(txHash);
        record.setTxNonce("0");
        return record;
    }
}
