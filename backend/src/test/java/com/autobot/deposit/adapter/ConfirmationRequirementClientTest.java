package com.autobot.deposit.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmationRequirementClientTest {

    private static final String BRIDGE = "https://bridge.example";

    private final StubChainRpcClient rpc = new StubChainRpcClient();
    private final ConfirmationRequirementClient client = new ConfirmationRequirementClient(rpc, new ObjectMapper(), BRIDGE);

    @Test
    void requiredConfirmations_numericString() {
        rpc.respond(BRIDGE + "/cosmos/bridge/chains/0", "{\"chain\":{\"id\":\"0\",\"type\":\"BITCOIN\",\"confirmations\":\"6\"}}");

        assertThat(client.requiredConfirmations("0")).isEqualTo(6);
    }

    @Test
    void requiredConfirmations_number() {
        rpc.respond(BRIDGE + "/cosmos/bridge/chains/2", "{\"chain\":{\"confirmations\":10}}");

        assertThat(client.requiredConfirmations("2")).isEqualTo(10);
    }

    @Test
    void requiredConfirmations_missing_throws() {
        rpc.respond(BRIDGE + "/cosmos/bridge/chains/9", "{\"code\":5,\"message\":\"chain not found\"}");

        assertThatThrownBy(() -> client.requiredConfirmations("9")).isInstanceOf(RpcException.class);
    }
}
