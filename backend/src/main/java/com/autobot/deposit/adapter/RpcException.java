package com.autobot.deposit.adapter;

/**
 * Thrown when a chain or bridge call fails (HTTP error, timeout, unexpected payload).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
