package com.lsemantica.core.pipeline;

/**
 * Reference from one artifact to an upstream artifact whose content influenced it.
 */
public record ArtifactRef(String artifactId, String artifactType, String schemaVersion) {

    public boolean refersTo(ArtifactType type) {
        return type.typeId().equals(artifactType) && type.schemaVersion().equals(schemaVersion);
    }

    String key() {
        return artifactType + "|" + schemaVersion + "|" + artifactId;
    }
}
