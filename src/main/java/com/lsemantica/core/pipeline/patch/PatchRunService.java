package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PathGlobs;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.trace.HookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Materializes a continued safe diff plan into a placeholder unified diff and gates it on
 * verification evidence. Every required check needs a result, a status other than
 * {@code not_run} and an evidence reference before a failing check is even considered.
 */
@Service
public class PatchRunService {

    private static final Logger log = LoggerFactory.getLogger(PatchRunService.class);

    public static final String DEFAULT_MATERIALIZATION = "deterministic_text_patch_v1";
    public static final List<String> DEFAULT_REQUIRED_CHECKS = List.of("lint", "typecheck", "test");

    public PatchRun run(SafeDiffPlan plan, PatchRunOptions options) {
        PatchRunOptions effective = options != null ? options : PatchRunOptions.of(List.of());
        validatePlan(plan);
        String materialization = HookResolver.trimToNull(effective.patchMaterialization());
        if (materialization == null) {
            materialization = DEFAULT_MATERIALIZATION;
        }
        List<String> requiredChecks = requiredChecks(effective.requiredChecks());
        List<VerificationResult> results = verificationResults(effective.verificationResults());
        List<String> policyPatterns = effective.policySensitivePathPatterns() == null
                ? List.copyOf(new TreeSet<>(SafeDiffPlanService.DEFAULT_ESCALATION_PATH_PATTERNS))
                : PathGlobs.normalizePatterns(effective.policySensitivePathPatterns(), PatchRunService::invalidOptions,
                        "Patch run policySensitivePathPatterns must contain non-empty strings");

        SafeDiffPlan.Payload upstream = plan.payload();
        List<PlanEdit> edits = List.of();
        Decision decision = Decision.STOP;
        ReasonCode reasonCode = ReasonCode.UNSUPPORTED_INPUT;
        String reasonDetail = "Patch generation did not run.";

        if (upstream.decision() != Decision.CONTINUE) {
            if (!upstream.reasonCode().allowedIn(ArtifactType.PATCH_RUN)) {
                throw invalidPlan("Patch run safe diff plan reason_code cannot be propagated by the pinned schema version");
            }
            decision = upstream.decision();
            reasonCode = upstream.reasonCode();
            reasonDetail = "Safe diff plan blocked patch generation: " + upstream.reasonDetail();
        } else if (upstream.edits().isEmpty()) {
            reasonDetail = "Safe diff plan continue decision did not include any edits to materialize.";
        } else {
            edits = materializableEdits(upstream.edits());
        }

        String content = PatchChunks.render(edits);
        Set<String> uniquePaths = new TreeSet<>();
        edits.forEach(edit -> uniquePaths.add(edit.path()));
        PatchRun.Patch patch = new PatchRun.Patch(PatchRun.FORMAT_UNIFIED_DIFF, content, uniquePaths.size(),
                edits.size());
        PatchRun.Verification verification = evaluate(requiredChecks, results);

        if (!edits.isEmpty()) {
            if (!verification.checksComplete() || !verification.evidenceComplete()) {
                reasonCode = ReasonCode.VERIFICATION_INCOMPLETE;
                reasonDetail = incompleteDetail(verification);
            } else if (!verification.allRequiredPassed()) {
                reasonCode = ReasonCode.VERIFICATION_FAILED;
                reasonDetail = "Required verification checks failed: "
                        + String.join(", ", verification.failingChecks()) + ".";
            } else {
                List<String> sensitive = PathGlobs.matching(uniquePaths, policyPatterns);
                if (!sensitive.isEmpty()) {
                    decision = Decision.ESCALATE;
                    reasonCode = ReasonCode.POLICY_BLOCKED;
                    reasonDetail = "Patch targets policy-sensitive paths requiring human review: "
                            + String.join(", ", sensitive) + ".";
                } else {
                    decision = Decision.CONTINUE;
                    reasonCode = ReasonCode.OK;
                    reasonDetail = "All required checks passed with complete evidence";
                }
            }
        }

        PatchRun.Trace trace = new PatchRun.Trace(materialization);
        PatchRun.Payload payload = new PatchRun.Payload(patch, Envelopes.digest(content), verification, decision,
                reasonCode, reasonDetail);
        List<ArtifactRef> inputs = List.of(plan.ref());
        PatchRun patchRun = new PatchRun(
                ArtifactType.PATCH_RUN.typeId(),
                ArtifactType.PATCH_RUN.schemaVersion(),
                Envelopes.artifactId(ArtifactType.PATCH_RUN, inputs, trace, payload),
                Envelopes.runId(effective.hooks(), plan.runId()),
                Envelopes.producedAt(effective.hooks()),
                Envelopes.toolVersion(effective.toolVersion()),
                inputs,
                trace,
                payload);
        log.info("Patch run {} -> {}/{} ({} file(s), {} hunk(s))", patchRun.artifactId(), decision.wireValue(),
                reasonCode.wireValue(), patch.fileCount(), patch.hunkCount());
        return patchRun;
    }

    static PatchRun.Verification evaluate(List<String> requiredChecks, List<VerificationResult> results) {
        Map<String, VerificationResult> byCheck = new LinkedHashMap<>();
        results.forEach(result -> byCheck.put(result.check(), result));
        List<String> missing = new ArrayList<>();
        Set<String> incomplete = new TreeSet<>();
        Set<String> failing = new TreeSet<>();
        boolean checksComplete = true;
        boolean evidenceComplete = true;
        boolean allPassed = true;

        for (String check : requiredChecks) {
            VerificationResult result = byCheck.get(check);
            if (result == null) {
                missing.add(check);
                incomplete.add(check);
                checksComplete = false;
                evidenceComplete = false;
                allPassed = false;
                continue;
            }
            if (result.evidenceRef() == null) {
                evidenceComplete = false;
                incomplete.add(check);
            }
            if (result.status() == CheckStatus.NOT_RUN) {
                checksComplete = false;
                incomplete.add(check);
                allPassed = false;
            } else if (result.status() == CheckStatus.FAIL) {
                failing.add(check);
                allPassed = false;
            }
        }
        return new PatchRun.Verification(requiredChecks, results, checksComplete, evidenceComplete, allPassed,
                List.copyOf(missing), List.copyOf(incomplete), List.copyOf(failing));
    }

    private static String incompleteDetail(PatchRun.Verification verification) {
        Set<String> notRunChecks = new HashSet<>();
        verification.results().stream()
                .filter(result -> result.status() == CheckStatus.NOT_RUN)
                .forEach(result -> notRunChecks.add(result.check()));

        List<String> parts = new ArrayList<>();
        if (!verification.missingRequiredChecks().isEmpty()) {
            parts.add("missing required checks: " + String.join(", ", verification.missingRequiredChecks()));
        }
        List<String> notRun = verification.incompleteChecks().stream().filter(notRunChecks::contains).toList();
        if (!notRun.isEmpty()) {
            parts.add("not-run required checks: " + String.join(", ", notRun));
        }
        List<String> missingEvidence = verification.incompleteChecks().stream()
                .filter(check -> !verification.missingRequiredChecks().contains(check) && !notRunChecks.contains(check))
                .toList();
        if (!missingEvidence.isEmpty()) {
            parts.add("missing evidence links for: " + String.join(", ", missingEvidence));
        }
        String summary = parts.isEmpty() ? "required verification evidence is incomplete" : String.join("; ", parts);
        return "Required verification evidence is incomplete: " + summary + ".";
    }

    private static List<PlanEdit> materializableEdits(List<PlanEdit> edits) {
        List<PlanEdit> normalized = new ArrayList<>(edits.size());
        for (int i = 0; i < edits.size(); i++) {
            PlanEdit edit = edits.get(i);
            String context = "Patch run safe diff plan payload.edits[" + i + "]";
            String path = PathGlobs.normalize(edit.path());
            if (path.equals(".")) {
                throw invalidPlan(context + " path must not be '.'");
            }
            if (PathGlobs.isOutsideWorkspace(path)) {
                throw invalidPlan(context + " path must remain within workspace-relative bounds");
            }
            normalized.add(new PlanEdit(path, edit.operation(), edit.justification(), edit.targetId(),
                    edit.symbolPath()));
        }
        return List.copyOf(normalized);
    }

    private static void validatePlan(SafeDiffPlan plan) {
        Envelopes.requireEnvelope(plan, ArtifactType.SAFE_DIFF_PLAN, ArtifactType.PATCH_RUN,
                PatchRunService::invalidPlan);
        SafeDiffPlan.Payload payload = plan.payload();
        if (payload == null || payload.decision() == null) {
            throw invalidPlan("Patch run safe diff plan payload.decision must be continue, escalate, or stop");
        }
        if (payload.reasonCode() == null || HookResolver.trimToNull(payload.reasonDetail()) == null) {
            throw invalidPlan("Patch run safe diff plan payload.reason_code and payload.reason_detail are required");
        }
        if (!payload.reasonCode().allowedIn(ArtifactType.SAFE_DIFF_PLAN)) {
            throw invalidPlan("Patch run safe diff plan payload.reason_code is unsupported for the pinned schema version");
        }
        if (payload.edits() == null) {
            throw invalidPlan("Patch run safe diff plan payload.edits must be an array");
        }
        for (int i = 0; i < payload.edits().size(); i++) {
            PlanEdit edit = payload.edits().get(i);
            String context = "Patch run safe diff plan payload.edits[" + i + "]";
            if (edit == null) {
                throw invalidPlan(context + " must be an object");
            }
            if (HookResolver.trimToNull(edit.path()) == null) {
                throw invalidPlan(context + " must include a non-empty path");
            }
            if (edit.operation() == null) {
                throw invalidPlan(
                        "Patch run safe diff plan payload.edits operation is unsupported for the pinned schema version");
            }
            if (HookResolver.trimToNull(edit.justification()) == null) {
                throw invalidPlan(context + ".justification is required");
            }
        }
    }

    private static List<String> requiredChecks(List<String> configured) {
        if (configured == null) {
            return List.copyOf(new TreeSet<>(DEFAULT_REQUIRED_CHECKS));
        }
        List<String> checks = PathGlobs.normalizePatterns(configured, PatchRunService::invalidOptions,
                "Patch run requiredChecks must contain non-empty strings");
        if (checks.isEmpty()) {
            throw invalidOptions("Patch run requiredChecks must include at least one required check");
        }
        return checks;
    }

    private static List<VerificationResult> verificationResults(List<VerificationResult> configured) {
        if (configured == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<VerificationResult> results = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            VerificationResult result = configured.get(i);
            if (result == null) {
                throw invalidOptions("Patch run verificationResults[" + i + "] must be an object");
            }
            String check = HookResolver.trimToNull(result.check());
            if (check == null) {
                throw invalidOptions("Patch run verificationResults[" + i + "].check must be a non-empty string");
            }
            if (!seen.add(check)) {
                throw invalidOptions("Patch run verificationResults contains duplicate check \"" + check + "\"");
            }
            results.add(new VerificationResult(check,
                    result.status() != null ? result.status() : CheckStatus.NOT_RUN,
                    HookResolver.trimToNull(result.evidenceRef()),
                    HookResolver.trimToNull(result.detail())));
        }
        results.sort(Comparator.comparing(VerificationResult::check));
        return List.copyOf(results);
    }

    private static PatchRunException invalidPlan(String message) {
        return new PatchRunException(PatchRunException.Code.INVALID_SAFE_DIFF_PLAN, message);
    }

    private static PatchRunException invalidOptions(String message) {
        return new PatchRunException(PatchRunException.Code.INVALID_OPTIONS, message);
    }
}
