package com.autobot.deposit.adapter;

/**
 * Hands a confirmed deposit to the bridge signer.
 */
public interface DepositSubmitter {

    /**
     * @throws DepositSubmissionException when the bridge rejects the deposit for any reason
     *                                    other than already knowing it
     */
    SubmitOutcome submit(String chainId, String txHash, String txNonce);

    enum SubmitOutcome {
        SUBMITTED,
        /** Bridge already had the deposit; treated as success. */
        ALREADY_EXISTS
    }
}
