package com.autobot.mirror.adapter;

/**
 * A git invocation exited non-zero, timed out or could not be started.
 */
public class GitCommandException extends RuntimeException {

    public GitCommandException(String message) {
        super(message);
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
