package com.lsemantica.core.pipeline;

/**
 * Artifact families produced by the pipeline, with their pinned schema versions.
 */
public enum ArtifactType {
    WORKSPACE_SNAPSHOT("ls.m2.workspace_snapshot", "wsnap_", "Workspace snapshot"),
    INTENT_MAPPING("ls.m2.intent_mapping", "imap_", "Intent mapping"),
    SAFE_DIFF_PLAN("ls.m2.safe_diff_plan", "dplan_", "Safe diff plan"),
    PATCH_RUN("ls.m2.patch_run", "patch_", "Patch run"),
    PR_BUNDLE("ls.m2.pr_bundle", "prb_", "PR bundle");

    public static final String SCHEMA_VERSION = "1.0.0";

    private final String typeId;
    private final String idPrefix;
    private final String label;

    ArtifactType(String typeId, String idPrefix, String label) {
        this.typeId = typeId;
        this.idPrefix = idPrefix;
        this.label = label;
    }

    public String typeId() {
        return typeId;
    }

    public String schemaVersion() {
        return SCHEMA_VERSION;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /** Human label used as the prefix of stage error messages. */
    public String label() {
        return label;
    }

    /** {@code type@version}, as used in compatibility errors. */
    public String pinned() {
        return typeId + "@" + SCHEMA_VERSION;
    }

    public ArtifactRef ref(String artifactId) {
        return new ArtifactRef(artifactId, typeId, SCHEMA_VERSION);
    }
}
