package com.lsemantica.core.pipeline.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;

import java.util.List;

/**
 * {@code ls.m2.workspace_snapshot@1.0.0}: repository head, dirty state, inventory and a
 * deterministic content hash. A snapshot is pure capture and carries no decision.
 */
public record WorkspaceSnapshot(
        String artifactType,
        String schemaVersion,
        String artifactId,
        String runId,
        String producedAtUtc,
        String toolVersion,
        List<ArtifactRef> inputs,
        Trace trace,
        Payload payload
) implements Artifact {

    public static final String TRACE_SOURCE = "local_git_worktree";

    public record Trace(String workspaceRoot, String source) {}

    public record Payload(Git git, Inventory inventory, Filters filters, String snapshotHash) {}

    public record Git(String headSha, String branch, @JsonProperty("is_dirty") boolean isDirty) {}

    public record Inventory(int filesScanned, int filesSupported, List<String> languages) {}

    public record Filters(List<String> ignoredPaths) {}
}
