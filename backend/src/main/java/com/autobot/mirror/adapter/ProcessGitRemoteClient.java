package com.autobot.mirror.adapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitRemoteClient} shelling out to the {@code git} binary. Credentials come from the process
 * environment (SSH agent, credential helper); prompting is disabled.
 */
@Slf4j
public class ProcessGitRemoteClient implements GitRemoteClient {

    private static final String HEADS_PREFIX = "refs/heads/";

    private final String gitExecutable;
    private final Duration commandTimeout;

    public ProcessGitRemoteClient(String gitExecutable, Duration commandTimeout) {
        this.gitExecutable = gitExecutable;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public Map<String, String> listHeads(String repositoryUrl) {
        return parseHeads(run(null, "ls-remote", "--heads", repositoryUrl));
    }

    @Override
    public MirrorWorkspace openWorkspace(String repositoryUrl) {
        Path dir;
        try {
            dir = Files.createTempDirectory("branch-mirror-");
        } catch (IOException e) {
            throw new GitCommandException("Cannot create mirror workspace", e);
        }
        try {
            run(dir, "init");
            run(dir, "remote", "add", "origin", repositoryUrl);
        } catch (RuntimeException e) {
            deleteWorkspace(dir);
            throw e;
        }
        return new ProcessMirrorWorkspace(dir);
    }

    /**
     * Parses {@code git ls-remote --heads} output ({@code <hash>\t refs/heads/<name>} per line).
     * Lines that are blank or not branch heads are ignored.
     */
    static Map<String, String> parseHeads(String output) {
        Map<String, String> heads = new LinkedHashMap<>();
        for (String line : output.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("\\s+");
            if (parts.length < 2 || !parts[1].startsWith(HEADS_PREFIX)) {
                continue;
            }
            String name = parts[1].substring(HEADS_PREFIX.length());
            if (!name.isEmpty()) {
                heads.put(name, parts[0]);
            }
        }
        return heads;
    }

    private String run(Path workDir, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(gitExecutable);
        command.addAll(List.of(args));
        log.debug("git {}", String.join(" ", args));

        File output = null;
        try {
            output = File.createTempFile("git-output-", ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output);
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            Process process = builder.start();
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitCommandException("git " + args[0] + " timed out after " + commandTimeout);
            }
            String text = Files.readString(output.toPath(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new GitCommandException("git " + args[0] + " exited with " + process.exitValue() + ": " + text.trim());
            }
            return text;
        } catch (IOException e) {
            throw new GitCommandException("git " + args[0] + " could not be run", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("git " + args[0] + " interrupted", e);
        } finally {
            if (output != null && !output.delete()) {
                log.debug("Could not delete {}", output);
            }
        }
    }

    private static void deleteWorkspace(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Failed to delete mirror workspace {}: {}", dir, e.getMessage());
        }
    }

    private final class ProcessMirrorWorkspace implements MirrorWorkspace {

        private final Path dir;

        private ProcessMirrorWorkspace(Path dir) {
            this.dir = dir;
        }

        @Override
        public void mirror(String branch, String mirrorBranch) {
            run(dir, "fetch", "--depth=1", "origin", branch);
            run(dir, "push", "--force", "origin", "FETCH_HEAD:refs/heads/" + mirrorBranch);
        }

        @Override
        public void close() {
            deleteWorkspace(dir);
        }
    }
}
