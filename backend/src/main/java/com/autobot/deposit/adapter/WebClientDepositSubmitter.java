package com.autobot.deposit.adapter;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * POSTs {@code {txHash, txNonce, chainId}} to the bridge submit endpoint. Hashes are sent 0x-prefixed.
 */
@Slf4j
public class WebClientDepositSubmitter implements DepositSubmitter {

    static final String ALREADY_EXISTS_MARKER = "deposit already exists";

    private final ChainRpcClient rpcClient;
    private final String submitUrl;

    public WebClientDepositSubmitter(ChainRpcClient rpcClient, String submitUrl) {
        this.rpcClient = rpcClient;
        this.submitUrl = submitUrl;
    }

    @Override
    public SubmitOutcome submit(String chainId, String txHash, String txNonce) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("txHash", normalizeTxHash(txHash));
        body.put("txNonce", txNonce);
        body.put("chainId", chainId);
        try {
            rpcClient.post(submitUrl, body).block();
            return SubmitOutcome.SUBMITTED;
        } catch (RuntimeException e) {
            if (isAlreadyExists(e)) {
                log.debug("Deposit {} on chain {} already known to bridge", txHash, chainId);
                return SubmitOutcome.ALREADY_EXISTS;
            }
            throw new DepositSubmissionException("Submit failed for " + txHash + " on chain " + chainId + ": " + e.getMessage(), e);
        }
    }

    static String normalizeTxHash(String txHash) {
        if (txHash.startsWith("0x") || txHash.startsWith("0X")) {
            return "0x" + txHash.substring(2);
        }
        return "0x" + txHash;
    }

    private static boolean isAlreadyExists(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(ALREADY_EXISTS_MARKER)) {
                return true;
            }
        }
        return false;
    }
}
