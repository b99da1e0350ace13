package com.autobot.mirror.job;

import com.autobot.common.Sleeper;
import com.autobot.engine.JobInitializationException;
import com.autobot.engine.JobSchedule;
import com.autobot.engine.JobTask;
import com.autobot.mirror.adapter.GitRemoteClient;
import com.autobot.mirror.adapter.MirrorWorkspace;
import com.autobot.mirror.config.MirrorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Copies every target branch of the repository onto its {@code -mirror} ref when the two differ.
 * Mirror operations are paced: a downstream test runner queues duplicate runs when mirrors update in
 * quick succession.
 */
@Component
@Slf4j
public class BranchMirrorJob implements JobTask {

    public static final String JOB_ID = "branch-mirror";
    public static final JobSchedule DEFAULT_SCHEDULE = JobSchedule.cron("5 0 * * *");

    private static final int SHORT_HASH = 12;

    private final GitRemoteClient gitClient;
    private final MirrorProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public BranchMirrorJob(GitRemoteClient gitClient, MirrorProperties properties) {
        this(gitClient, properties, Sleeper.SYSTEM);
    }

    BranchMirrorJob(GitRemoteClient gitClient, MirrorProperties properties, Sleeper sleeper) {
        this.gitClient = gitClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public void initialize() {
        if (!StringUtils.hasText(properties.getRepositoryUrl())) {
            throw new JobInitializationException("autobot.mirror.repository-url must be configured");
        }
    }

    @Override
    public void run() throws InterruptedException {
        String repositoryUrl = properties.getRepositoryUrl();
        Map<String, String> heads = gitClient.listHeads(repositoryUrl);
        int mirrored = 0;
        int failed = 0;
        try (MirrorWorkspace workspace = gitClient.openWorkspace(repositoryUrl)) {
            boolean pauseBeforeNext = false;
            for (Map.Entry<String, String> head : heads.entrySet()) {
                String branch = head.getKey();
                if (!isTargetBranch(branch)) {
                    continue;
                }
                String hash = head.getValue();
                String mirrorBranch = branch + properties.getMirrorSuffix();
                String mirrorHash = heads.get(mirrorBranch);
                if (hash.equals(mirrorHash)) {
                    log.debug("Mirror up-to-date: {} -> {}", mirrorBranch, shortHash(hash));
                    continue;
                }
                if (pauseBeforeNext) {
                    sleeper.sleep(properties.getPauseBetweenMirrors());
                }
                pauseBeforeNext = true;
                try {
                    workspace.mirror(branch, mirrorBranch);
                    log.info("{} mirror: {} -> {}", mirrorHash == null ? "Created" : "Updated",
                            mirrorBranch, shortHash(hash));
                    mirrored++;
                } catch (RuntimeException e) {
                    log.warn("Failed to update mirror {}: {}", mirrorBranch, e.getMessage(), e);
                    failed++;
                }
            }
        }
        log.info("Branch mirror pass complete: {} mirrored, {} failed", mirrored, failed);
    }

    boolean isTargetBranch(String branch) {
        if (branch.endsWith(properties.getMirrorSuffix())) {
            return false;
        }
        for (String suffix : properties.getBranchSuffixes()) {
            if (branch.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static String shortHash(String hash) {
        return hash.length() > SHORT_HASH ? hash.substring(0, SHORT_HASH) : hash;
    }
}
