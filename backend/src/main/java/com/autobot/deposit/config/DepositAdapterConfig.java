package com.autobot.deposit.config;

import com.autobot.common.RetryPolicy;
import com.autobot.deposit.adapter.BlockbookChainAdapter;
import com.autobot.deposit.adapter.ChainAdapter;
import com.autobot.deposit.adapter.ChainAdapterRegistry;
import com.autobot.deposit.adapter.ChainRpcClient;
import com.autobot.deposit.adapter.ConfirmationRequirementClient;
import com.autobot.deposit.adapter.DepositSubmitter;
import com.autobot.deposit.adapter.RpcEndpointRotator;
import com.autobot.deposit.adapter.WebClientChainRpcClient;
import com.autobot.deposit.adapter.WebClientDepositSubmitter;
import com.autobot.deposit.adapter.ZanoChainAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires chain adapters from {@code autobot.deposit.chains} and the bridge clients.
 */
@Configuration
@Slf4j
public class DepositAdapterConfig {

    @Bean
    public ChainRpcClient chainRpcClient(WebClient.Builder webClientBuilder, DepositProperties properties) {
        return new WebClientChainRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public RateLimiter chainRpcRateLimiter(DepositProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofMillis(properties.getLimiterTimeoutMs()))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    @Bean
    public ChainAdapterRegistry chainAdapterRegistry(DepositProperties properties, ChainRpcClient chainRpcClient,
                                                     RateLimiter chainRpcRateLimiter, ObjectMapper objectMapper) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(), properties.getRetryJitterFactor(), properties.getRetryMaxAttempts());
        List<ChainAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, DepositProperties.ChainEntry> entry : properties.getChains().entrySet()) {
            String chainId = entry.getKey();
            DepositProperties.ChainEntry chain = entry.getValue();
            if (chain.getType() == null || chain.getUrls().isEmpty()) {
                log.warn("Chain {} has no type or urls configured, skipped", chainId);
                continue;
            }
            RpcEndpointRotator rotator = new RpcEndpointRotator(chain.getUrls(), retryPolicy);
            adapters.add(switch (chain.getType()) {
                case BLOCKBOOK -> new BlockbookChainAdapter(chainId, rotator, chainRpcClient, chainRpcRateLimiter, objectMapper);
                case ZANO -> new ZanoChainAdapter(chainId, rotator, chainRpcClient, chainRpcRateLimiter, objectMapper);
            });
            log.info("Chain {} served by {} adapter ({} endpoint(s))", chainId, chain.getType(), chain.getUrls().size());
        }
        return new ChainAdapterRegistry(adapters);
    }

    @Bean
    public ConfirmationRequirementClient confirmationRequirementClient(ChainRpcClient chainRpcClient,
                                                                       ObjectMapper objectMapper,
                                                                       DepositProperties properties) {
        return new ConfirmationRequirementClient(chainRpcClient, objectMapper, properties.getBridgeApiUrl());
    }

    @Bean
    public DepositSubmitter depositSubmitter(ChainRpcClient chainRpcClient, DepositProperties properties) {
        return new WebClientDepositSubmitter(chainRpcClient, properties.getSubmitUrl());
    }
}
