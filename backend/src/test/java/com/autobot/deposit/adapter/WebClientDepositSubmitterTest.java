package com.autobot.deposit.adapter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientDepositSubmitterTest {

    private static final String SUBMIT = "https://tss.example/submit";

    private final StubChainRpcClient rpc = new StubChainRpcClient();
    private final WebClientDepositSubmitter submitter = new WebClientDepositSubmitter(rpc, SUBMIT);

    @Test
    @DisplayName("hash is sent 0x-prefixed with nonce and chain id")
    void submit_ok_postsNormalizedHash() {
        rpc.respond(SUBMIT, "{}");

        assertThat(submitter.submit("0", "ab12", "3")).isEqualTo(DepositSubmitter.SubmitOutcome.SUBMITTED);

        assertThat(rpc.postedBodies).containsExactly(Map.of("txHash", "0xab12", "txNonce", "3", "chainId", "0"));
    }

    @Test
    void submit_alreadyExists_treatedAsSuccess() {
        rpc.respond(SUBMIT, new RpcException("POST failed: 400 BAD_REQUEST {\"message\":\"Deposit already exists\"}"));

        assertThat(submitter.submit("2", "0xab12", "0")).isEqualTo(DepositSubmitter.SubmitOutcome.ALREADY_EXISTS);
    }

    @Test
    void submit_otherFailure_throws() {
        rpc.respond(SUBMIT, new RpcException("POST failed: 503 SERVICE_UNAVAILABLE"));

        assertThatThrownBy(() -> submitter.submit("0", "ab12", "1"))
                .isInstanceOf(DepositSubmissionException.class)
                .hasMessageContaining("ab12");
    }

    @Test
    void normalizeTxHash() {
        assertThat(WebClientDepositSubmitter.normalizeTxHash("ab12")).isEqualTo("0xab12");
        assertThat(WebClientDepositSubmitter.normalizeTxHash("0xab12")).isEqualTo("0xab12");
        assertThat(WebClientDepositSubmitter.normalizeTxHash("0XAB12")).isEqualTo("0xAB12");
    }
}
