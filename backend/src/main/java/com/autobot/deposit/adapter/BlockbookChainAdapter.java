package com.autobot.deposit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;

/**
 * Blockbook REST indexer (Bitcoin): {@code GET /} for the best height, {@code GET /tx/<txid>} for the
 * transaction's block height (negative while in the mempool).
 */
public class BlockbookChainAdapter extends AbstractChainAdapter {

    public BlockbookChainAdapter(String chainId, RpcEndpointRotator rotator, ChainRpcClient rpcClient,
                                 RateLimiter rateLimiter, ObjectMapper objectMapper) {
        super(chainId, rotator, rpcClient, rateLimiter, objectMapper);
    }

    @Override
    public long getChainHeight() {
        JsonNode root = callWithRetry("getChainHeight", base -> rpcClient.get(trimSlash(base) + "/"));
        return requireLong(root, "blockbook", "bestHeight");
    }

    @Override
    public long getTxHeight(String txHash) {
        JsonNode root = callWithRetry("getTxHeight", base -> rpcClient.get(trimSlash(base) + "/tx/" + txHash));
        return Math.max(requireLong(root, "blockHeight"), 0L);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
