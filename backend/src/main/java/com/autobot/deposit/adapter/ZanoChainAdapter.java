package com.autobot.deposit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;

import java.util.Map;

/**
 * Zano daemon: {@code GET /getheight} for the chain height, JSON-RPC {@code get_tx_details} for the
 * keeper block of a transaction.
 */
public class ZanoChainAdapter extends AbstractChainAdapter {

    private static final String STATUS_OK = "OK";

    public ZanoChainAdapter(String chainId, RpcEndpointRotator rotator, ChainRpcClient rpcClient,
                            RateLimiter rateLimiter, ObjectMapper objectMapper) {
        super(chainId, rotator, rpcClient, rateLimiter, objectMapper);
    }

    @Override
    public long getChainHeight() {
        JsonNode root = callWithRetry("getChainHeight", base -> rpcClient.get(base + "/getheight"));
        requireStatusOk(root.path("status"));
        return requireLong(root, "height");
    }

    @Override
    public long getTxHeight(String txHash) {
        Map<String, Object> body = Map.of(
                "id", 0,
                "jsonrpc", "2.0",
                "method", "get_tx_details",
                "params", Map.of("tx_hash", txHash));
        JsonNode root = callWithRetry("getTxHeight", base -> rpcClient.post(base + "/json_rpc", body));
        requireStatusOk(root.path("result").path("status"));
        return Math.max(requireLong(root, "result", "tx_info", "keeper_block"), 0L);
    }

    private static void requireStatusOk(JsonNode status) {
        if (!STATUS_OK.equals(status.asText())) {
            throw new RpcException("Zano status is not OK: " + status.asText());
        }
    }
}
