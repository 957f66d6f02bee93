package com.lsemantica.core.pipeline.intent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ReasonCode;

import java.util.List;

/**
 * {@code ls.m2.intent_mapping@1.0.0}: ranked repository targets for a free-text intent.
 */
public record IntentMapping(
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

    public record Trace(String intentSource, List<ExtractionMethod> extractionMethods) {}

    public record Payload(
            Intent intent,
            List<Candidate> candidates,
            List<Candidate> alternatives,
            Decision decision,
            ReasonCode reasonCode,
            String reasonDetail
    ) {}

    public record Intent(String summary) {}

    /**
     * @param symbolPath {@code goal}, {@code capability:<name>} or {@code check:<name>} for AST
     *                   hits; {@code null} for whole-file text matches
     */
    public record Candidate(
            String targetId,
            String path,
            @JsonInclude(JsonInclude.Include.ALWAYS) String symbolPath,
            double confidence,
            String rationale,
            Provenance provenance
    ) {

        String key() {
            return symbolPath == null ? path : path + "#" + symbolPath;
        }
    }

    /** {@code range} is omitted for text matches with no matching line. */
    public record Provenance(String sourcePath, ExtractionMethod method, CandidateRange range) {}

    public record CandidateRange(int startLine, int startColumn, int endLine, int endColumn) {}
}
