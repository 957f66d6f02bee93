package com.lsemantica.core.pipeline;

import java.util.List;

/**
 * Envelope shared by every pipeline artifact. Artifacts are immutable records; downstream
 * stages hold them only through {@link ArtifactRef}s.
 */
public interface Artifact {

    String artifactType();

    String schemaVersion();

    String artifactId();

    String runId();

    String producedAtUtc();

    String toolVersion();

    List<ArtifactRef> inputs();

    default ArtifactRef ref() {
        return new ArtifactRef(artifactId(), artifactType(), schemaVersion());
    }
}
