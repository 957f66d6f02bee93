package com.lsemantica.core.pipeline.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads HEAD, branch and porcelain status by shelling out to the {@code git} CLI. Nothing is
 * ever written to the repository.
 */
@Component
public class GitCliMetadataReader implements GitMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(GitCliMetadataReader.class);

    @Override
    public GitSummary read(Path workspaceRoot) {
        String headSha = runGit(workspaceRoot, "rev-parse", "HEAD").trim();
        String branch = runGit(workspaceRoot, "rev-parse", "--abbrev-ref", "HEAD").trim();
        String statusPorcelain = runGit(workspaceRoot, "status", "--porcelain", "--untracked-files=all")
                .lines()
                .map(String::stripTrailing)
                .filter(line -> !line.isEmpty())
                .sorted()
                .collect(Collectors.joining("\n"));

        if (headSha.isEmpty() || branch.isEmpty()) {
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE,
                    "Git metadata is missing required HEAD or branch information", workspaceRoot.toString());
        }
        return new GitSummary(headSha, branch, !statusPorcelain.isEmpty(), statusPorcelain);
    }

    String runGit(Path workspaceRoot, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.add("-C");
        command.add(workspaceRoot.toString());
        command.addAll(Arrays.asList(args));
        String label = String.join(" ", args);
        log.debug("Running (capture): git {}", label);
        return capture(command, workspaceRoot, label);
    }

    /** Runs {@code command} in {@code workspaceRoot} and returns its stdout. */
    String capture(List<String> command, Path workspaceRoot, String label) {
        Path stderrFile = null;
        Process process = null;
        try {
            // stderr goes to a file so a chatty child can never block on a full pipe
            stderrFile = Files.createTempFile("lsemantica-git-", ".stderr");
            process = new ProcessBuilder(command)
                    .directory(workspaceRoot.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
                log.warn("Git command exited with code {}: {}", exitCode, label);
                throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE,
                        "Failed to read git metadata (" + label + ")" + (stderr.isEmpty() ? "" : ": " + stderr),
                        workspaceRoot.toString());
            }
            return output;
        } catch (IOException e) {
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE,
                    "Failed to read git metadata (" + label + "): " + e.getMessage(), workspaceRoot.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE,
                    "Interrupted while reading git metadata (" + label + ")", workspaceRoot.toString(), e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroy();
            }
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete git stderr capture {}: {}", file, e.getMessage());
        }
    }
}
