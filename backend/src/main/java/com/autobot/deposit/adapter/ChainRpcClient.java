package com.autobot.deposit.adapter;

import reactor.core.publisher.Mono;

/**
 * HTTP transport for chain adapters. Errors surface as {@link RpcException}.
 */
public interface ChainRpcClient {

    /** GET returning the response body (JSON). */
    Mono<String> get(String url);

    /** POST a JSON body, returning the response body (JSON). */
    Mono<String> post(String url, Object body);
}
