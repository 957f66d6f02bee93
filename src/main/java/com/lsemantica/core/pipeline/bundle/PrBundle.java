package com.lsemantica.core.pipeline.bundle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.diffplan.EditOperation;
import com.lsemantica.core.pipeline.patch.VerificationResult;

import java.util.List;

/**
 * {@code ls.m2.pr_bundle@1.0.0}: a human-reviewable, PR-equivalent package of a patch run with
 * rollback material, risk notes and the full lineage chain.
 */
public record PrBundle(
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

    public static final String BOUNDARY_MODE = "artifact_only";
    public static final String ROLLBACK_STRATEGY = "reverse_patch";

    public record Trace(List<String> lineage, String boundaryMode) {}

    public record Payload(
            String summary,
            String rationale,
            BundlePatch patch,
            List<String> riskTradeoffs,
            @JsonInclude(JsonInclude.Include.ALWAYS) String verificationEvidenceRef,
            BundleVerification verification,
            Rollback rollback,
            Traceability traceability,
            Readiness readiness
    ) {}

    public record BundlePatch(String format, String digest, String content, int fileCount, int hunkCount,
                              String patchRunArtifactId) {}

    public record BundleVerification(
            String patchRunArtifactId,
            List<String> requiredChecks,
            List<VerificationResult> results,
            boolean checksComplete,
            boolean evidenceComplete,
            boolean allRequiredPassed,
            List<String> missingRequiredChecks,
            List<String> incompleteChecks,
            List<String> failingChecks
    ) {}

    public record Rollback(
            String strategy,
            boolean supported,
            @JsonInclude(JsonInclude.Include.ALWAYS) String packageRef,
            @JsonProperty("package") @JsonInclude(JsonInclude.Include.ALWAYS) RollbackPackage rollbackPackage,
            List<String> instructions
    ) {}

    public record RollbackPackage(String format, String content, String digest, int fileCount, int hunkCount) {}

    public record Traceability(
            boolean lineageComplete,
            Chain chain,
            String intentSummary,
            List<MappedTarget> mappedTargets,
            List<EditSummary> diffPlanEdits,
            PatchRunOutcome patchRunOutcome
    ) {}

    /** Absent upstream links are omitted; {@code patchRun} is always present. */
    public record Chain(ArtifactRef workspaceSnapshot, ArtifactRef intentMapping, ArtifactRef safeDiffPlan,
                        ArtifactRef patchRun) {}

    public record MappedTarget(String targetId, String path,
                               @JsonInclude(JsonInclude.Include.ALWAYS) String symbolPath) {}

    public record EditSummary(String path, EditOperation operation, String targetId, String symbolPath) {}

    public record PatchRunOutcome(Decision decision, ReasonCode reasonCode, String reasonDetail) {}

    public record Readiness(
            Decision decision,
            ReasonCode reasonCode,
            String reasonDetail,
            RequiredSections requiredSections,
            List<String> missingSections
    ) {}

    public record RequiredSections(
            boolean patchDigest,
            boolean patchPayload,
            boolean changeSummary,
            boolean changeRationale,
            boolean riskTradeoffs,
            boolean verificationLink,
            boolean verificationResults,
            boolean rollbackPackage,
            boolean rollbackInstructions,
            boolean lineageTraceComplete
    ) {}
}
