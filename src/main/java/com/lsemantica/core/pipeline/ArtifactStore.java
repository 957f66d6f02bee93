package com.lsemantica.core.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only arena of pipeline artifacts keyed by {@code artifact_id}. Artifacts are never
 * replaced or removed; lineage is walked through the {@code inputs} references.
 */
public class ArtifactStore {

    private final Map<String, Artifact> artifacts = new ConcurrentHashMap<>();

    /**
     * Stores an artifact. Storing an equal artifact again is a no-op.
     *
     * @throws IllegalStateException when a different artifact is already stored under the same id
     */
    public <A extends Artifact> A put(A artifact) {
        Artifact existing = artifacts.putIfAbsent(artifact.artifactId(), artifact);
        if (existing != null && !existing.equals(artifact)) {
            throw new IllegalStateException("Artifact " + artifact.artifactId()
                    + " is already stored with different content");
        }
        return artifact;
    }

    public Optional<Artifact> find(String artifactId) {
        return Optional.ofNullable(artifacts.get(artifactId));
    }

    /**
     * Resolves a reference, checking that the stored artifact has the referenced family and
     * version and is of the requested Java type.
     */
    public <A extends Artifact> A resolve(ArtifactRef ref, Class<A> type) {
        Artifact artifact = artifacts.get(ref.artifactId());
        if (artifact == null) {
            throw new IllegalArgumentException("Unknown artifact " + ref.artifactId());
        }
        if (!artifact.ref().equals(ref)) {
            throw new IllegalArgumentException("Artifact " + ref.artifactId() + " is "
                    + artifact.artifactType() + "@" + artifact.schemaVersion() + ", not "
                    + ref.artifactType() + "@" + ref.schemaVersion());
        }
        if (!type.isInstance(artifact)) {
            throw new IllegalArgumentException("Artifact " + ref.artifactId() + " is not a " + type.getSimpleName());
        }
        return type.cast(artifact);
    }

    /**
     * Upstream references of {@code artifactId}, breadth-first and deduplicated. References to
     * artifacts not held in this store are listed but not expanded.
     */
    public List<ArtifactRef> lineage(String artifactId) {
        Artifact root = artifacts.get(artifactId);
        if (root == null) {
            throw new IllegalArgumentException("Unknown artifact " + artifactId);
        }
        List<ArtifactRef> ordered = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<Artifact> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            for (ArtifactRef input : queue.poll().inputs()) {
                if (!seen.add(input.key())) {
                    continue;
                }
                ordered.add(input);
                Artifact upstream = artifacts.get(input.artifactId());
                if (upstream != null) {
                    queue.add(upstream);
                }
            }
        }
        return ordered;
    }

    public int size() {
        return artifacts.size();
    }
}
