package com.lsemantica.core.pipeline.diffplan;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ReasonCode;

import java.util.List;

/**
 * {@code ls.m2.safe_diff_plan@1.0.0}: bounded, safety-checked edit list for one mapped intent.
 */
public record SafeDiffPlan(
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

    public record Trace(String plannerProfile) {}

    public record Payload(
            List<PlanEdit> edits,
            SafetyChecks safetyChecks,
            Decision decision,
            ReasonCode reasonCode,
            String reasonDetail
    ) {}

    public record SafetyChecks(
            List<String> forbiddenPathPatterns,
            List<String> escalationPathPatterns,
            Bound maxFileChanges,
            Bound maxHunks
    ) {}

    public record Bound(int limit, int observed) {

        boolean exceeded() {
            return observed > limit;
        }
    }
}
