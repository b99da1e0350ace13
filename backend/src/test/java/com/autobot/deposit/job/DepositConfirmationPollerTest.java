package com.autobot.deposit.job;

import com.autobot.deposit.adapter.ChainAdapter;
import com.autobot.deposit.adapter.ChainAdapterRegistry;
import com.autobot.deposit.adapter.ConfirmationRequirementClient;
import com.autobot.deposit.adapter.DepositSubmissionException;
import com.autobot.deposit.adapter.DepositSubmitter;
import com.autobot.deposit.adapter.RpcException;
import com.autobot.deposit.store.DepositRecordStore;
import com.autobot.domain.ConfirmationRecord;
import com.autobot.polling.PollSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DepositConfirmationPollerTest {

    @Mock
    DepositRecordStore recordStore;
    @Mock
    ConfirmationRequirementClient requirementClient;
    @Mock
    DepositSubmitter submitter;
    @Mock
    ChainAdapter bitcoin;
    @Mock
    ChainAdapter zano;

    DepositConfirmationPoller poller;

    @BeforeEach
    void setUp() {
        lenient().when(bitcoin.chainId()).thenReturn("0");
        lenient().when(zano.chainId()).thenReturn("2");
        poller = new DepositConfirmationPoller(recordStore, new ChainAdapterRegistry(List.of(bitcoin, zano)),
                requirementClient, submitter);
    }

    @Test
    @DisplayName("required 6, confirmed at 100: not submitted at chain height 104")
    void notEnoughConfirmations_noSubmit() {
        ConfirmationRecord record = record("0", "aa11", 100);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(104L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(6);

        poller.poll();

        verify(submitter, never()).submit(anyString(), anyString(), anyString());
        verify(recordStore, never()).delete(any());
    }

    @Test
    @DisplayName("required 6, confirmed at 100: submitted and deleted at chain height 105")
    void enoughConfirmations_submittedAndDeleted() {
        ConfirmationRecord record = record("0", "aa11", 100);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(105L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(6);
        when(submitter.submit("0", "aa11", "1")).thenReturn(DepositSubmitter.SubmitOutcome.SUBMITTED);

        poller.poll();

        verify(submitter).submit("0", "aa11", "1");
        verify(recordStore).delete(record);
    }

    @Test
    @DisplayName("'deposit already exists' still deletes the record")
    void alreadyExists_deleted() {
        ConfirmationRecord record = record("0", "aa11", 100);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(200L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(6);
        when(submitter.submit("0", "aa11", "1")).thenReturn(DepositSubmitter.SubmitOutcome.ALREADY_EXISTS);

        PollSummary summary = poller.poll();

        verify(recordStore).delete(record);
        assertThat(summary.failedItems()).isZero();
    }

    @Test
    void submitRejected_recordKeptForNextPass() {
        ConfirmationRecord record = record("0", "aa11", 100);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(200L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(6);
        when(submitter.submit("0", "aa11", "1"))
                .thenThrow(new DepositSubmissionException("503", new RpcException("unavailable")));

        PollSummary summary = poller.poll();

        verify(recordStore, never()).delete(any());
        assertThat(summary.failedItems()).isEqualTo(1);
    }

    @Test
    @DisplayName("pending record learns its height, then is checked in the same pass")
    void pendingRecord_heightRecordedThenGated() {
        ConfirmationRecord record = record("0", "bb22", 0);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(102L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(3);
        when(bitcoin.getTxHeight("bb22")).thenReturn(100L);
        when(recordStore.recordHeight(record, 100L)).thenAnswer(inv -> {
            record.setConfirmedHeight(100L);
            return record;
        });
        when(submitter.submit("0", "bb22", "1")).thenReturn(DepositSubmitter.SubmitOutcome.SUBMITTED);

        poller.poll();

        verify(recordStore).recordHeight(record, 100L);
        verify(recordStore).delete(record);
    }

    @Test
    void unconfirmedTransaction_staysPending() {
        ConfirmationRecord record = record("0", "cc33", 0);
        givenPending(Map.of("0", List.of(record)));
        when(bitcoin.getChainHeight()).thenReturn(500L);
        when(requirementClient.requiredConfirmations("0")).thenReturn(1);
        when(bitcoin.getTxHeight("cc33")).thenReturn(0L);

        poller.poll();

        verify(recordStore, never()).recordHeight(any(), anyLong());
        verify(submitter, never()).submit(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("an unreachable chain skips only that chain's batch")
    void chainHeightFailure_otherChainsContinue() {
        ConfirmationRecord btc = record("0", "aa11", 100);
        ConfirmationRecord zec = record("2", "dd44", 50);
        Map<String, List<ConfirmationRecord>> pending = new LinkedHashMap<>();
        pending.put("0", List.of(btc));
        pending.put("2", List.of(zec));
        givenPending(pending);
        when(bitcoin.getChainHeight()).thenThrow(new RpcException("blockbook down"));
        when(zano.getChainHeight()).thenReturn(60L);
        when(requirementClient.requiredConfirmations("2")).thenReturn(10);
        when(submitter.submit("2", "dd44", "1")).thenReturn(DepositSubmitter.SubmitOutcome.SUBMITTED);

        PollSummary summary = poller.poll();

        verify(recordStore).delete(zec);
        verify(recordStore, never()).delete(btc);
        assertThat(summary.failedEntities()).isEqualTo(1);
    }

    @Test
    @DisplayName("unsupported chain ids are skipped, not failed")
    void unsupportedChain_skipped() {
        givenPending(Map.of("7", List.of(record("7", "ee55", 0))));

        PollSummary summary = poller.poll();

        assertThat(summary.entities()).isZero();
        verify(requirementClient, never()).requiredConfirmations(anyString());
    }

    @Test
    void isConfirmed_boundary() {
        assertThat(DepositConfirmationPoller.isConfirmed(100, 6, 104)).isFalse();
        assertThat(DepositConfirmationPoller.isConfirmed(100, 6, 105)).isTrue();
        assertThat(DepositConfirmationPoller.isConfirmed(100, 1, 100)).isTrue();
        assertThat(DepositConfirmationPoller.isConfirmed(0, 1, 100)).isFalse();
    }

    private void givenPending(Map<String, List<ConfirmationRecord>> pending) {
        when(recordStore.listPendingByChain()).thenReturn(pending);
    }

    private static ConfirmationRecord record(String chainId, String txHash, long confirmedHeight) {
        ConfirmationRecord record = new ConfirmationRecord();
        record.setId(ConfirmationRecord.idOf(chainId, txHash));
        record.setChainId(chainId);
        record.setTxHash(txHash);
        record.setTxNonce("1");
        record.setConfirmedHeight(confirmedHeight);
        return record;
    }
}
