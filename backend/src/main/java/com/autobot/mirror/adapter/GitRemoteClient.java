package com.autobot.mirror.adapter;

import java.util.Map;

/**
 * Remote git operations used by the branch mirror.
 */
public interface GitRemoteClient {

    /**
     * Branch heads of the remote, branch name (without {@code refs/heads/}) to commit hash.
     */
    Map<String, String> listHeads(String repositoryUrl);

    /**
     * Fresh local repository with {@code origin} pointing at the remote. Caller closes it.
     */
    MirrorWorkspace openWorkspace(String repositoryUrl);
}
