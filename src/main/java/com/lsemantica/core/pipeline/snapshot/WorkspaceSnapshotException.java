package com.lsemantica.core.pipeline.snapshot;

import com.lsemantica.core.pipeline.PipelineException;

public class WorkspaceSnapshotException extends PipelineException {

    public enum Code {
        INVALID_WORKSPACE_ROOT,
        WORKSPACE_ROOT_UNREADABLE,
        WORKSPACE_ROOT_NOT_DIRECTORY,
        INVALID_IGNORED_PATHS,
        WORKSPACE_ENTRY_UNREADABLE,
        GIT_METADATA_UNAVAILABLE
    }

    private final Code code;
    private final String workspaceRoot;

    public WorkspaceSnapshotException(Code code, String message, String workspaceRoot) {
        super(message);
        this.code = code;
        this.workspaceRoot = workspaceRoot;
    }

    public WorkspaceSnapshotException(Code code, String message, String workspaceRoot, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.workspaceRoot = workspaceRoot;
    }

    public Code code() {
        return code;
    }

    public String workspaceRoot() {
        return workspaceRoot;
    }

    @Override
    public String codeName() {
        return code.name();
    }
}
