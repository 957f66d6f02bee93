package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ReasonCode;

import java.util.List;

/**
 * {@code ls.m2.patch_run@1.0.0}: the materialized patch for a safe diff plan together with the
 * verification evidence that gates it.
 */
public record PatchRun(
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

    public static final String FORMAT_UNIFIED_DIFF = "unified_diff";

    public record Trace(String patchMaterialization) {}

    public record Payload(
            Patch patch,
            String patchDigest,
            Verification verification,
            Decision decision,
            ReasonCode reasonCode,
            String reasonDetail
    ) {}

    public record Patch(String format, String content, int fileCount, int hunkCount) {}

    public record Verification(
            List<String> requiredChecks,
            List<VerificationResult> results,
            boolean checksComplete,
            boolean evidenceComplete,
            boolean allRequiredPassed,
            List<String> missingRequiredChecks,
            List<String> incompleteChecks,
            List<String> failingChecks
    ) {}
}
