package com.lsemantica.core.pipeline.snapshot;

import com.lsemantica.core.trace.GovernanceHooks;

import java.util.List;

/**
 * @param ignoredPaths {@code null} selects {@link WorkspaceSnapshotService#DEFAULT_IGNORED_PATHS}
 * @param hooks        clock and run id factory; the run id falls back to a random UUID
 */
public record WorkspaceSnapshotOptions(
        String workspaceRoot,
        List<String> ignoredPaths,
        GovernanceHooks hooks,
        String toolVersion
) {

    public static WorkspaceSnapshotOptions of(String workspaceRoot) {
        return new WorkspaceSnapshotOptions(workspaceRoot, null, null, null);
    }

    public WorkspaceSnapshotOptions withIgnoredPaths(List<String> ignoredPaths) {
        return new WorkspaceSnapshotOptions(workspaceRoot, ignoredPaths, hooks, toolVersion);
    }

    public WorkspaceSnapshotOptions withHooks(GovernanceHooks hooks) {
        return new WorkspaceSnapshotOptions(workspaceRoot, ignoredPaths, hooks, toolVersion);
    }

    public WorkspaceSnapshotOptions withToolVersion(String toolVersion) {
        return new WorkspaceSnapshotOptions(workspaceRoot, ignoredPaths, hooks, toolVersion);
    }
}
