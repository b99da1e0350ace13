package com.autobot.mirror.adapter;

/**
 * Scratch repository used to copy one remote branch onto another ref of the same remote.
 */
public interface MirrorWorkspace extends AutoCloseable {

    /**
     * Shallow-fetches {@code branch} and force-pushes it to {@code refs/heads/<mirrorBranch>}.
     *
     * @throws GitCommandException if either step fails
     */
    void mirror(String branch, String mirrorBranch);

    /** Removes the scratch directory. */
    @Override
    void close();
}
