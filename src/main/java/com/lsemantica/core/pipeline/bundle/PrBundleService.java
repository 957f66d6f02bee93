package com.lsemantica.core.pipeline.bundle;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Artifact;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PathGlobs;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.patch.PatchChunks;
import com.lsemantica.core.pipeline.patch.PatchRun;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import com.lsemantica.core.trace.HookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Packages a patch run and its lineage into a PR-equivalent bundle. The bundle never changes
 * the patch run's own decision; its readiness section only reports whether every required
 * section is present.
 */
@Service
public class PrBundleService {

    private static final Logger log = LoggerFactory.getLogger(PrBundleService.class);

    private static final int SUMMARY_LENGTH = 160;
    private static final int RATIONALE_PATH_LIMIT = 3;

    static final List<String> SECTION_ORDER = List.of(
            "patch_digest",
            "patch_payload",
            "change_summary",
            "change_rationale",
            "risk_tradeoffs",
            "verification_link",
            "verification_results",
            "rollback_package",
            "rollback_instructions",
            "lineage_trace_complete");

    public PrBundle bundle(PatchRun patchRun, PrBundleOptions options) {
        PrBundleOptions effective = options != null ? options : PrBundleOptions.of(PrBundleOptions.Lineage.none());
        ArtifactRef planRef = validatePatchRun(patchRun);
        PrBundleOptions.Lineage lineage = effective.lineage() != null ? effective.lineage()
                : PrBundleOptions.Lineage.none();
        boolean lineageComplete = validateLineage(patchRun, planRef, lineage);
        PatchRun.Payload upstream = patchRun.payload();

        String summary = summary(effective.summary(), lineage, patchRun);
        String rationale = rationale(effective.rationale(), lineage, patchRun);
        List<String> risks = riskTradeoffs(effective.riskTradeoffs(), upstream, lineageComplete);
        String evidenceRef = verificationEvidenceRef(effective, patchRun);
        PrBundle.Rollback rollback = rollback(lineage.safeDiffPlan(), patchRun.artifactId(), effective.rollback());

        PrBundle.BundlePatch patch = new PrBundle.BundlePatch(upstream.patch().format(), upstream.patchDigest(),
                upstream.patch().content(), upstream.patch().fileCount(), upstream.patch().hunkCount(),
                patchRun.artifactId());
        PatchRun.Verification checks = upstream.verification();
        PrBundle.BundleVerification verification = new PrBundle.BundleVerification(patchRun.artifactId(),
                checks.requiredChecks(), checks.results(), checks.checksComplete(), checks.evidenceComplete(),
                checks.allRequiredPassed(), checks.missingRequiredChecks(), checks.incompleteChecks(),
                checks.failingChecks());

        PrBundle.Traceability traceability = new PrBundle.Traceability(
                lineageComplete,
                new PrBundle.Chain(refOf(lineage.workspaceSnapshot()), refOf(lineage.intentMapping()),
                        refOf(lineage.safeDiffPlan()), patchRun.ref()),
                lineage.intentMapping() != null ? lineage.intentMapping().payload().intent().summary().trim() : null,
                mappedTargets(lineage.intentMapping()),
                editSummaries(lineage.safeDiffPlan()),
                new PrBundle.PatchRunOutcome(upstream.decision(), upstream.reasonCode(), upstream.reasonDetail()));

        PrBundle.Readiness readiness = readiness(upstream, patch, summary, rationale, risks, evidenceRef, rollback,
                lineageComplete);

        List<ArtifactRef> inputs = inputs(lineage, patchRun);
        PrBundle.Trace trace = new PrBundle.Trace(
                inputs.stream().map(ArtifactRef::artifactId).distinct().toList(), PrBundle.BOUNDARY_MODE);
        PrBundle.Payload payload = new PrBundle.Payload(summary, rationale, patch, risks, evidenceRef, verification,
                rollback, traceability, readiness);
        PrBundle bundle = new PrBundle(
                ArtifactType.PR_BUNDLE.typeId(),
                ArtifactType.PR_BUNDLE.schemaVersion(),
                Envelopes.artifactId(ArtifactType.PR_BUNDLE, inputs, trace, payload),
                Envelopes.runId(effective.hooks(), patchRun.runId()),
                Envelopes.producedAt(effective.hooks()),
                Envelopes.toolVersion(effective.toolVersion()),
                inputs,
                trace,
                payload);
        log.info("PR bundle {} readiness {}/{} (lineage complete={}, missing={})", bundle.artifactId(),
                readiness.decision().wireValue(), readiness.reasonCode().wireValue(), lineageComplete,
                readiness.missingSections());
        return bundle;
    }

    private static PrBundle.Readiness readiness(PatchRun.Payload upstream, PrBundle.BundlePatch patch, String summary,
                                                String rationale, List<String> risks, String evidenceRef,
                                                PrBundle.Rollback rollback, boolean lineageComplete) {
        PatchRun.Verification verification = upstream.verification();
        boolean rollbackReady = rollback.supported() && rollback.packageRef() != null
                && rollback.rollbackPackage() != null && !rollback.rollbackPackage().content().isEmpty()
                && !rollback.rollbackPackage().digest().isEmpty();
        PrBundle.RequiredSections sections = new PrBundle.RequiredSections(
                !patch.digest().isEmpty(),
                !patch.content().isEmpty(),
                !summary.isBlank(),
                !rationale.isBlank(),
                !risks.isEmpty(),
                evidenceRef != null && !evidenceRef.isEmpty(),
                verification.checksComplete() && verification.evidenceComplete() && verification.allRequiredPassed(),
                rollbackReady,
                !rollback.instructions().isEmpty(),
                lineageComplete);
        boolean[] present = {
                sections.patchDigest(), sections.patchPayload(), sections.changeSummary(), sections.changeRationale(),
                sections.riskTradeoffs(), sections.verificationLink(), sections.verificationResults(),
                sections.rollbackPackage(), sections.rollbackInstructions(), sections.lineageTraceComplete()};
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < present.length; i++) {
            if (!present[i]) {
                missing.add(SECTION_ORDER.get(i));
            }
        }
        if (missing.isEmpty()) {
            return new PrBundle.Readiness(Decision.CONTINUE, ReasonCode.OK,
                    "PR-equivalent bundle includes patch payload, rationale, risk tradeoffs, verification "
                            + "linkage/results, rollback package/instructions, and complete lineage trace.",
                    sections, List.of());
        }

        ReasonCode reasonCode = ReasonCode.BUNDLE_INCOMPLETE;
        if (!verification.checksComplete() || !verification.evidenceComplete()) {
            reasonCode = ReasonCode.VERIFICATION_INCOMPLETE;
        } else if (!verification.allRequiredPassed()) {
            reasonCode = ReasonCode.VERIFICATION_FAILED;
        } else if (upstream.decision() == Decision.STOP && upstream.reasonCode().allowedIn(ArtifactType.PATCH_RUN)) {
            reasonCode = upstream.reasonCode();
        } else if (!rollbackReady) {
            reasonCode = ReasonCode.ROLLBACK_UNAVAILABLE;
        }
        String upstreamDetail = upstream.decision() == Decision.CONTINUE ? ""
                : " Upstream patch run outcome=" + upstream.decision().wireValue() + "/"
                        + upstream.reasonCode().wireValue() + ".";
        return new PrBundle.Readiness(Decision.STOP, reasonCode,
                "PR-equivalent bundle is not ready; missing required sections: " + String.join(", ", missing) + "."
                        + upstreamDetail,
                sections, List.copyOf(missing));
    }

    static PrBundle.Rollback rollback(SafeDiffPlan plan, String patchRunId,
                                      PrBundleOptions.RollbackOverrides overrides) {
        String strategy = PrBundle.ROLLBACK_STRATEGY;
        if (overrides != null && overrides.strategy() != null && !overrides.strategy().equals(strategy)) {
            throw invalidOptions("PR bundle rollback.strategy must be reverse_patch when provided");
        }
        List<String> instructionsOverride = overrides == null ? null
                : stringList(overrides.instructions(), "PR bundle rollback.instructions");
        String packageRefOverride = overrides == null ? null : HookResolver.trimToNull(overrides.packageRef());

        boolean buildable = plan != null && !plan.payload().edits().isEmpty();
        boolean supported = overrides != null && overrides.supported() != null ? overrides.supported() : buildable;
        if (!supported || !buildable) {
            return new PrBundle.Rollback(strategy, false, packageRefOverride, null,
                    instructionsOverride != null ? instructionsOverride : List.of());
        }

        List<PlanEdit> edits = plan.payload().edits();
        String content = PatchChunks.renderRollback(edits);
        String digest = Envelopes.digest(content);
        Set<String> paths = new TreeSet<>();
        edits.forEach(edit -> paths.add(edit.path()));
        String packageRef = packageRefOverride != null ? packageRefOverride
                : "rollback_" + Envelopes.shortDigest(digest);
        PrBundle.RollbackPackage rollbackPackage = new PrBundle.RollbackPackage(PatchRun.FORMAT_UNIFIED_DIFF, content,
                digest, paths.size(), edits.size());
        List<String> instructions = instructionsOverride != null ? instructionsOverride : List.of(
                "Apply rollback package " + packageRef + " as a unified diff against the same workspace baseline "
                        + "expected by patch run " + patchRunId + ".",
                "Use safe diff plan " + plan.artifactId() + " as the authoritative path/order reference when "
                        + "reviewing rollback hunks.",
                "Verify the target workspace state matches the expected pre-apply conditions before executing "
                        + "rollback.",
                "Re-run required checks and record evidence linkage in the future apply/rollback artifact.");
        return new PrBundle.Rollback(strategy, true, packageRef, rollbackPackage, instructions);
    }

    private static String summary(String explicit, PrBundleOptions.Lineage lineage, PatchRun patchRun) {
        String value = HookResolver.trimToNull(explicit);
        if (value != null) {
            return value;
        }
        if (lineage.intentMapping() != null) {
            return Envelopes.singleLine(lineage.intentMapping().payload().intent().summary(), SUMMARY_LENGTH);
        }
        String base = "PR-equivalent bundle for patch run " + patchRun.artifactId();
        return patchRun.payload().decision() == Decision.ESCALATE ? base + " (human review required)" : base;
    }

    private static String rationale(String explicit, PrBundleOptions.Lineage lineage, PatchRun patchRun) {
        String value = HookResolver.trimToNull(explicit);
        if (value != null) {
            return value;
        }
        List<PlanEdit> edits = lineage.safeDiffPlan() != null ? lineage.safeDiffPlan().payload().edits() : List.of();
        if (!edits.isEmpty()) {
            String paths = edits.stream().limit(RATIONALE_PATH_LIMIT).map(PlanEdit::path)
                    .collect(Collectors.joining(", "));
            int extra = Math.max(0, edits.size() - RATIONALE_PATH_LIMIT);
            return "Packages patch run " + patchRun.artifactId() + " with " + edits.size()
                    + " planned edit(s) from safe diff plan " + lineage.safeDiffPlan().artifactId() + ": " + paths
                    + (extra > 0 ? " (+" + extra + " more)" : "") + ".";
        }
        return "Packages patch run " + patchRun.artifactId() + " into a human-inspectable PR-equivalent artifact "
                + "bundle for review and downstream apply/rollback gating.";
    }

    private static List<String> riskTradeoffs(List<String> explicit, PatchRun.Payload upstream,
                                              boolean lineageComplete) {
        List<String> configured = stringList(explicit, "PR bundle riskTradeoffs");
        if (configured != null) {
            return configured;
        }
        List<String> risks = new ArrayList<>();
        risks.add("Patch content remains a deterministic placeholder unified diff intended for review/package "
                + "handoff, not full file-content patch synthesis.");
        if (upstream.decision() == Decision.ESCALATE && upstream.reasonCode() == ReasonCode.POLICY_BLOCKED) {
            risks.add("Patch run marked policy-sensitive paths; human review is required before any apply decision.");
        } else if (upstream.decision() == Decision.STOP) {
            risks.add("Patch run blocked continuation (" + upstream.reasonCode().wireValue()
                    + "); this bundle is inspection-only and not apply-ready.");
        }
        if (!lineageComplete) {
            risks.add("Lineage trace is incomplete; bundle should not be used as an autonomous apply prerequisite.");
        }
        return List.copyOf(risks);
    }

    private static String verificationEvidenceRef(PrBundleOptions options, PatchRun patchRun) {
        if (options.omitVerificationEvidenceRef()) {
            return null;
        }
        if (options.verificationEvidenceRef() != null) {
            return HookResolver.trimToNull(options.verificationEvidenceRef());
        }
        return patchRun.artifactId();
    }

    private static List<PrBundle.MappedTarget> mappedTargets(IntentMapping mapping) {
        if (mapping == null) {
            return List.of();
        }
        return mapping.payload().candidates().stream()
                .map(candidate -> new PrBundle.MappedTarget(candidate.targetId().trim(),
                        candidate.path().trim().replace('\\', '/'), HookResolver.trimToNull(candidate.symbolPath())))
                .toList();
    }

    private static List<PrBundle.EditSummary> editSummaries(SafeDiffPlan plan) {
        if (plan == null) {
            return List.of();
        }
        return plan.payload().edits().stream()
                .map(edit -> new PrBundle.EditSummary(edit.path(), edit.operation(), edit.targetId(),
                        edit.symbolPath()))
                .toList();
    }

    private static List<ArtifactRef> inputs(PrBundleOptions.Lineage lineage, PatchRun patchRun) {
        Map<String, ArtifactRef> ordered = new LinkedHashMap<>();
        for (ArtifactRef ref : new ArtifactRef[]{refOf(lineage.workspaceSnapshot()), refOf(lineage.intentMapping()),
                refOf(lineage.safeDiffPlan()), patchRun.ref()}) {
            if (ref != null) {
                ordered.putIfAbsent(ref.artifactType() + "|" + ref.schemaVersion() + "|" + ref.artifactId(), ref);
            }
        }
        return List.copyOf(ordered.values());
    }

    private static ArtifactRef refOf(Artifact artifact) {
        return artifact == null ? null : artifact.ref();
    }

    /** Returns the patch run's safe diff plan input reference. */
    private static ArtifactRef validatePatchRun(PatchRun patchRun) {
        Envelopes.requireEnvelope(patchRun, ArtifactType.PATCH_RUN, ArtifactType.PR_BUNDLE,
                PrBundleService::invalidPatchRun);
        ArtifactRef planRef = singleInput(patchRun.inputs(), ArtifactType.SAFE_DIFF_PLAN,
                "PR bundle patch run inputs", PrBundleService::invalidPatchRun);
        if (planRef == null) {
            throw invalidPatchRun("PR bundle patch run inputs must include a "
                    + ArtifactType.SAFE_DIFF_PLAN.typeId() + " reference");
        }
        PatchRun.Payload payload = patchRun.payload();
        if (payload == null || payload.patch() == null
                || !PatchRun.FORMAT_UNIFIED_DIFF.equals(payload.patch().format())) {
            throw invalidPatchRun("PR bundle patch run payload.patch.format must be unified_diff");
        }
        if (payload.patch().content() == null) {
            throw invalidPatchRun("PR bundle patch run payload.patch.content must be a string");
        }
        if (HookResolver.trimToNull(payload.patchDigest()) == null) {
            throw invalidPatchRun("PR bundle patch run payload.patch_digest is required");
        }
        if (!Envelopes.digest(payload.patch().content()).equals(payload.patchDigest().trim())) {
            throw invalidPatchRun("PR bundle patch run payload.patch_digest does not match payload.patch.content");
        }
        if (payload.patch().fileCount() < 0 || payload.patch().hunkCount() < 0) {
            throw invalidPatchRun(
                    "PR bundle patch run payload.patch.file_count and hunk_count must be non-negative integers");
        }
        if (payload.verification() == null) {
            throw invalidPatchRun("PR bundle patch run payload.verification is required");
        }
        if (payload.verification().requiredChecks() == null) {
            throw invalidPatchRun("PR bundle patch run payload.verification.required_checks must be an array");
        }
        if (payload.verification().results() == null) {
            throw invalidPatchRun("PR bundle patch run payload.verification.results must be an array");
        }
        if (payload.decision() == null) {
            throw invalidPatchRun("PR bundle patch run payload.decision must be continue, escalate, or stop");
        }
        if (payload.reasonCode() == null || HookResolver.trimToNull(payload.reasonDetail()) == null) {
            throw invalidPatchRun("PR bundle patch run payload.reason_code and payload.reason_detail are required");
        }
        if (!payload.reasonCode().allowedIn(ArtifactType.PATCH_RUN)) {
            throw invalidPatchRun("PR bundle patch run payload.reason_code is unsupported for the pinned schema version");
        }
        return planRef;
    }

    /**
     * Checks the optional lineage artifacts against the patch run: shared run id and matching
     * input references along the chain. Returns whether the chain is complete.
     */
    private static boolean validateLineage(PatchRun patchRun, ArtifactRef planRef, PrBundleOptions.Lineage lineage) {
        WorkspaceSnapshot snapshot = lineage.workspaceSnapshot();
        IntentMapping mapping = lineage.intentMapping();
        SafeDiffPlan plan = lineage.safeDiffPlan();

        if (snapshot != null) {
            requireLineageEnvelope(snapshot, ArtifactType.WORKSPACE_SNAPSHOT, "workspaceSnapshot");
        }
        ArtifactRef snapshotRef = null;
        if (mapping != null) {
            requireLineageEnvelope(mapping, ArtifactType.INTENT_MAPPING, "intentMapping");
            snapshotRef = singleInput(mapping.inputs(), ArtifactType.WORKSPACE_SNAPSHOT,
                    "PR bundle lineage.intentMapping inputs", PrBundleService::invalidLineage);
            if (mapping.payload() == null || mapping.payload().intent() == null
                    || HookResolver.trimToNull(mapping.payload().intent().summary()) == null) {
                throw invalidLineage("PR bundle lineage.intentMapping payload.intent.summary is required");
            }
            if (mapping.payload().candidates() == null) {
                throw invalidLineage("PR bundle lineage.intentMapping payload.candidates must be an array");
            }
            for (int i = 0; i < mapping.payload().candidates().size(); i++) {
                IntentMapping.Candidate candidate = mapping.payload().candidates().get(i);
                if (candidate == null || HookResolver.trimToNull(candidate.targetId()) == null
                        || HookResolver.trimToNull(candidate.path()) == null) {
                    throw invalidLineage("PR bundle lineage.intentMapping payload.candidates[" + i
                            + "] must include target_id and path");
                }
            }
        }
        ArtifactRef mappingRef = null;
        if (plan != null) {
            requireLineageEnvelope(plan, ArtifactType.SAFE_DIFF_PLAN, "safeDiffPlan");
            mappingRef = singleInput(plan.inputs(), ArtifactType.INTENT_MAPPING,
                    "PR bundle lineage.safeDiffPlan inputs", PrBundleService::invalidLineage);
            if (plan.payload() == null || plan.payload().edits() == null) {
                throw invalidLineage("PR bundle lineage.safeDiffPlan payload.edits must be an array");
            }
            for (int i = 0; i < plan.payload().edits().size(); i++) {
                validateLineageEdit(plan.payload().edits().get(i),
                        "PR bundle lineage.safeDiffPlan payload.edits[" + i + "]");
            }
        }

        Set<String> runIds = new LinkedHashSet<>();
        runIds.add(patchRun.runId());
        if (plan != null) {
            runIds.add(plan.runId());
        }
        if (mapping != null) {
            runIds.add(mapping.runId());
        }
        if (snapshot != null) {
            runIds.add(snapshot.runId());
        }
        if (runIds.size() > 1) {
            throw invalidLineage("PR bundle lineage artifacts must share a run_id with patch run; observed: "
                    + String.join(", ", runIds));
        }

        if (plan != null && !planRef.equals(plan.ref())) {
            throw invalidLineage("PR bundle lineage.safeDiffPlan does not match patch run inputs reference");
        }
        if (mapping != null && mappingRef != null && !mappingRef.equals(mapping.ref())) {
            throw invalidLineage("PR bundle lineage.intentMapping does not match safe diff plan inputs reference");
        }
        if (snapshot != null && snapshotRef != null && !snapshotRef.equals(snapshot.ref())) {
            throw invalidLineage("PR bundle lineage.workspaceSnapshot does not match intent mapping inputs reference");
        }
        return snapshot != null && mapping != null && plan != null
                && mappingRef != null && snapshotRef != null;
    }

    private static void requireLineageEnvelope(Artifact artifact, ArtifactType type, String name) {
        String context = "PR bundle lineage." + name;
        if (!type.typeId().equals(artifact.artifactType())) {
            throw invalidLineage(context + " must be " + type.typeId());
        }
        if (!type.schemaVersion().equals(artifact.schemaVersion())) {
            throw invalidLineage(context + " must be " + type.pinned());
        }
        if (HookResolver.trimToNull(artifact.artifactId()) == null || HookResolver.trimToNull(artifact.runId()) == null) {
            throw invalidLineage(context + " is missing required envelope fields");
        }
    }

    private static void validateLineageEdit(PlanEdit edit, String context) {
        if (edit == null) {
            throw invalidLineage(context + " must be an object");
        }
        String path = HookResolver.trimToNull(edit.path());
        if (path == null) {
            throw invalidLineage(context + ".path must be a non-empty string");
        }
        String normalized = PathGlobs.normalize(path);
        if (normalized.equals(".") || PathGlobs.isOutsideWorkspace(normalized)) {
            throw invalidLineage(context + ".path must be workspace-relative");
        }
        if (edit.operation() == null) {
            throw invalidLineage(context + ".operation is unsupported for the pinned schema version");
        }
        if (HookResolver.trimToNull(edit.justification()) == null) {
            throw invalidLineage(context + ".justification is required");
        }
    }

    private static ArtifactRef singleInput(List<ArtifactRef> inputs, ArtifactType type, String context,
                                           Function<String, PrBundleException> error) {
        List<ArtifactRef> matches = inputs == null ? List.of() : inputs.stream()
                .filter(Objects::nonNull)
                .filter(ref -> type.typeId().equals(ref.artifactType()))
                .toList();
        if (matches.size() > 1) {
            throw error.apply(context + " must not include multiple " + type.typeId() + " inputs");
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static List<String> stringList(List<String> values, String context) {
        if (values == null) {
            return null;
        }
        List<String> normalized = new ArrayList<>(values.size());
        for (String value : values) {
            String trimmed = HookResolver.trimToNull(value);
            if (trimmed == null) {
                throw invalidOptions(context + " must contain non-empty strings");
            }
            normalized.add(trimmed);
        }
        return List.copyOf(normalized);
    }

    private static PrBundleException invalidPatchRun(String message) {
        return new PrBundleException(PrBundleException.Code.INVALID_PATCH_RUN, message);
    }

    private static PrBundleException invalidLineage(String message) {
        return new PrBundleException(PrBundleException.Code.INVALID_LINEAGE, message);
    }

    private static PrBundleException invalidOptions(String message) {
        return new PrBundleException(PrBundleException.Code.INVALID_OPTIONS, message);
    }
}
