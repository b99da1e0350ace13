package com.autobot.deposit.adapter;

public class DepositSubmissionException extends RuntimeException {

    public DepositSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
