package com.autobot.deposit.adapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chain adapters keyed by bridge chain id.
 */
public class ChainAdapterRegistry {

    private final Map<String, ChainAdapter> adapters = new LinkedHashMap<>();

    public ChainAdapterRegistry(List<ChainAdapter> adapters) {
        for (ChainAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.chainId(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate chain adapter for chain " + adapter.chainId());
            }
        }
    }

    public Optional<ChainAdapter> find(String chainId) {
        return Optional.ofNullable(adapters.get(chainId));
    }

    public Set<String> supportedChainIds() {
        return adapters.keySet();
    }
}
