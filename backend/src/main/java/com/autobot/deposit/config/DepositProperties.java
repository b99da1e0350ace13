package com.autobot.deposit.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deposit confirmation config: bridge endpoints, per-chain RPC adapters, retry and rate limits.
 * Chain keys are bridge chain ids (e.g. "0" = Bitcoin, "2" = Zano).
 */
@ConfigurationProperties(prefix = "autobot.deposit")
@NoArgsConstructor
@Getter
@Setter
public class DepositProperties {

    /** Base URL of the bridge REST API serving per-chain confirmation requirements. */
    private String bridgeApiUrl = "https://rpc-api.node0.mainnet.bridgeless.com";

    /** Endpoint receiving confirmed deposits. */
    private String submitUrl = "https://tss1.mainnet.bridgeless.com/submit";

    private long requestTimeoutMs = 30_000;

    /** Upper bound on chain RPC calls per second, across all chains. */
    private int maxRequestsPerSecond = 5;

    /** How long a chain call may wait for a rate-limiter permit before failing. */
    private long limiterTimeoutMs = 10_000;

    private long retryBaseDelayMs = 1_000;
    private double retryJitterFactor = 0.2;
    private int retryMaxAttempts = 3;

    private Map<String, ChainEntry> chains = new HashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        this.chains = chains != null ? chains : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private ChainType type;
        private List<String> urls = new ArrayList<>();

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }

    public enum ChainType {
        /** Blockbook REST indexer (Bitcoin). */
        BLOCKBOOK,
        /** Zano daemon REST + JSON-RPC. */
        ZANO
    }
}
