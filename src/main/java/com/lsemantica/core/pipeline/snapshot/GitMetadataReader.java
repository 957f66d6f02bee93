package com.lsemantica.core.pipeline.snapshot;

import java.nio.file.Path;

/**
 * Source of repository metadata for a workspace snapshot.
 */
public interface GitMetadataReader {

    /**
     * @throws WorkspaceSnapshotException with {@code GIT_METADATA_UNAVAILABLE} when the
     *                                    metadata cannot be read
     */
    GitSummary read(Path workspaceRoot);

    /**
     * @param statusPorcelain sorted, non-empty porcelain status lines joined by {@code \n}
     */
    record GitSummary(String headSha, String branch, boolean dirty, String statusPorcelain) {}
}
