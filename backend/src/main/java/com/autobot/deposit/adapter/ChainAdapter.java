package com.autobot.deposit.adapter;

/**
 * Block-height queries for one chain.
 */
public interface ChainAdapter {

    /** Bridge chain id this adapter serves. */
    String chainId();

    /**
     * Current best block height.
     *
     * @throws RpcException if the chain cannot be queried
     */
    long getChainHeight();

    /**
     * Height of the block containing the transaction, or 0 while it is unconfirmed.
     *
     * @throws RpcException if the chain cannot be queried or does not know the transaction
     */
    long getTxHeight(String txHash);
}
