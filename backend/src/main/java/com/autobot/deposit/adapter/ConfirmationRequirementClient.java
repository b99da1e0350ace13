package com.autobot.deposit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads how many confirmations the bridge requires for a chain:
 * {@code GET <bridgeApiUrl>/cosmos/bridge/chains/<chainId>} → {@code chain.confirmations}.
 */
@Slf4j
public class ConfirmationRequirementClient {

    private final ChainRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final String bridgeApiUrl;

    public ConfirmationRequirementClient(ChainRpcClient rpcClient, ObjectMapper objectMapper, String bridgeApiUrl) {
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.bridgeApiUrl = bridgeApiUrl;
    }

    /**
     * @throws RpcException if the bridge cannot be queried or the response lacks a positive count
     */
    public int requiredConfirmations(String chainId) {
        String url = bridgeApiUrl + "/cosmos/bridge/chains/" + chainId;
        String json = rpcClient.get(url).block();
        if (json == null) {
            throw new RpcException("Empty bridge chain response for chain " + chainId);
        }
        JsonNode confirmations;
        try {
            confirmations = objectMapper.readTree(json).path("chain").path("confirmations");
        } catch (JsonProcessingException e) {
            throw new RpcException("Malformed bridge chain response for chain " + chainId, e);
        }
        // Served as a number or as a numeric string depending on the bridge version.
        int value = confirmations.asInt(0);
        if (value <= 0) {
            throw new RpcException("Bridge returned no confirmation requirement for chain " + chainId);
        }
        log.debug("Chain {} requires {} confirmation(s)", chainId, value);
        return value;
    }
}
