package com.autobot.deposit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Shared call path for chain adapters: rate-limiter permit, endpoint rotation, retry with backoff,
 * JSON parsing.
 */
@Slf4j
public abstract class AbstractChainAdapter implements ChainAdapter {

    private final String chainId;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    protected final ChainRpcClient rpcClient;
    protected final ObjectMapper objectMapper;

    protected AbstractChainAdapter(String chainId, RpcEndpointRotator rotator, ChainRpcClient rpcClient,
                                   RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.chainId = chainId;
        this.rotator = rotator;
        this.rpcClient = rpcClient;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public String chainId() {
        return chainId;
    }

    /**
     * Calls {@code request} against rotating endpoints until it returns a parseable JSON body or the
     * retry policy is exhausted.
     */
    protected JsonNode callWithRetry(String operation, Function<String, Mono<String>> request) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new RpcException("Local limiter timeout before " + operation + " on " + endpoint);
                }
                String json = request.apply(endpoint).block();
                if (json == null || json.isBlank()) {
                    throw new RpcException("Empty response for " + operation + " from " + endpoint);
                }
                return objectMapper.readTree(json);
            } catch (Exception e) {
                lastException = e;
                log.debug("Chain {} {} attempt {} on {} failed: {}", chainId, operation, attempt + 1, endpoint, e.getMessage());
            }
        }
        throw new RpcException("Chain " + chainId + " " + operation + " failed after " + rotator.getMaxAttempts()
                + " attempt(s): " + messageOf(lastException), lastException);
    }

    /** Numeric field at {@code path}, failing if absent. */
    protected static long requireLong(JsonNode root, String... path) {
        JsonNode node = root;
        for (String field : path) {
            node = node.path(field);
        }
        if (!node.isNumber()) {
            throw new RpcException("Missing numeric field " + String.join(".", path) + " in response");
        }
        return node.asLong();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
