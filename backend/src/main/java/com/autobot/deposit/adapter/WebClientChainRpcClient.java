package com.autobot.deposit.adapter;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link ChainRpcClient} on WebClient with a per-request timeout.
 */
public class WebClientChainRpcClient implements ChainRpcClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientChainRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> get(String url) {
        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException("GET " + url + " failed: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e));
    }

    @Override
    public Mono<String> post(String url, Object body) {
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException("POST " + url + " failed: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e));
    }
}
