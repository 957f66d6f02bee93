package com.lsemantica.core.repair;

import com.lsemantica.core.contract.ContractName;
import com.lsemantica.core.feedback.FailureStage;
import com.lsemantica.core.feedback.FeedbackTensor;
import com.lsemantica.core.feedback.FeedbackTensorFactory;
import com.lsemantica.core.feedback.ProposedAction;
import com.lsemantica.core.feedback.SourceStage;
import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.trace.GovernanceHooks;
import com.lsemantica.core.trace.HookResolver;
import com.lsemantica.core.trace.NdjsonSink;
import com.lsemantica.core.trace.TraceError;
import com.lsemantica.core.trace.TraceInspectionEntry;
import com.lsemantica.core.trace.TraceInspectionReport;

import java.util.List;

/**
 * Writes the FeedbackTensor and trace inspection records for a finished repair run. Sink
 * failures are absorbed by {@link NdjsonSink}; nothing here can change the result.
 */
class RepairTraceEmitter {

    private final NdjsonSink sink;

    RepairTraceEmitter(NdjsonSink sink) {
        this.sink = sink;
    }

    void emit(RepairRequest request, RepairResult result, RepairOptions options, String runId, String startedAt) {
        GovernanceHooks hooks = options.hooksOrDefaults();
        String completedAt = options.emitsInspection() ? HookResolver.resolveTimestamp(hooks.clock()) : null;
        String traceEntryId = HookResolver.trimToNull(options.traceEntryId());

        TraceInspectionEntry.FeedbackSummary feedback = TraceInspectionEntry.FeedbackSummary.notConfigured();
        if (options.feedbackTensorPath() != null) {
            FeedbackTensor tensor = buildFeedbackTensor(request, result, hooks, runId, traceEntryId);
            boolean emitted = sink.appendRecord(options.feedbackTensorPath(), tensor, "feedback-tensor");
            feedback = TraceInspectionEntry.FeedbackSummary.of(tensor, emitted, options.feedbackTensorPath().toString());
        }

        if (!options.emitsInspection()) {
            return;
        }
        TraceInspectionEntry entry = new TraceInspectionEntry(
                TraceInspectionEntry.SCHEMA_VERSION,
                runId,
                startedAt,
                completedAt,
                completedAt,
                result.decision() == RepairDecision.REPAIRED
                        ? TraceInspectionEntry.Invocation.success(traceEntryId != null ? traceEntryId : "repair-" + runId)
                        : TraceInspectionEntry.Invocation.failure(result.reasonCode(),
                                new TraceError("RepairLoopDecisionError", result.detail())),
                null,
                toSummary(result),
                new TraceInspectionEntry.LedgerSummary(traceEntryId != null, false, null, traceEntryId),
                feedback);
        sink.appendRecord(options.traceInspectionPath(), entry, "trace-inspection");
        sink.appendText(options.traceInspectionReportPath(), TraceInspectionReport.format(entry),
                "trace-inspection-report");
    }

    static FeedbackTensor buildFeedbackTensor(RepairRequest request, RepairResult result, GovernanceHooks hooks,
                                              String runId, String traceEntryId) {
        return FeedbackTensorFactory.create(new FeedbackTensor(
                FeedbackTensor.SCHEMA_VERSION,
                HookResolver.resolveFeedbackId(hooks.feedbackIdFactory(), runId),
                HookResolver.resolveTimestamp(hooks.clock()),
                new FeedbackTensor.FailureSignal(result.classification(), FailureStage.REPAIR, result.detail(),
                        result.continuationAllowed(), result.reasonCode()),
                confidence(result.decision()),
                alternatives(result.decision()),
                action(request, result),
                new FeedbackTensor.Provenance(runId, SourceStage.REPAIR_LOOP, traceEntryId,
                        new FeedbackTensor.ContractVersions(
                                ContractName.SEMANTIC_IR.supportedVersion(),
                                ContractName.POLICY_PROFILE.supportedVersion(),
                                FeedbackTensor.SCHEMA_VERSION))));
    }

    private static FeedbackTensor.Confidence confidence(RepairDecision decision) {
        return switch (decision) {
            case REPAIRED -> new FeedbackTensor.Confidence(0.9,
                    "Deterministic repair rules produced a policy-safe continuation outcome.", CalibrationBand.HIGH);
            case ESCALATE -> new FeedbackTensor.Confidence(0.45,
                    "No deterministic in-scope repair satisfied safety constraints for continuation.",
                    CalibrationBand.MEDIUM);
            case STOP -> new FeedbackTensor.Confidence(0.2,
                    "Repair loop reached an explicit terminal stop condition with continuation blocked.",
                    CalibrationBand.LOW);
        };
    }

    private static List<FeedbackTensor.Alternative> alternatives(RepairDecision decision) {
        return switch (decision) {
            case REPAIRED -> List.of(
                    new FeedbackTensor.Alternative("alt-continue-with-repair",
                            "Proceed using the deterministic repaired payload.",
                            "Execution continues with a bounded, reason-coded repair lineage.", 0.9),
                    new FeedbackTensor.Alternative("alt-manual-verify-repair",
                            "Escalate the repaired payload for manual verification before continuation.",
                            "Continuation remains blocked until a reviewer approves the repaired path.", 0.98));
            case ESCALATE -> List.of(
                    new FeedbackTensor.Alternative("alt-request-manual-review",
                            "Escalate repair decision to a human reviewer.",
                            "Manual adjudication selects an approved remediation path.", 0.95),
                    new FeedbackTensor.Alternative("alt-abort",
                            "Abort autonomous continuation for this run.",
                            "System halts unsafe continuation until explicit external intervention.", 1.0));
            case STOP -> List.of(
                    new FeedbackTensor.Alternative("alt-abort",
                            "Terminate autonomous continuation immediately.",
                            "No unsafe continuation after terminal stop condition.", 1.0),
                    new FeedbackTensor.Alternative("alt-manual-postmortem",
                            "Route full repair history to human review for postmortem triage.",
                            "Reviewer determines whether to retry externally or leave run terminated.", 0.95));
        };
    }

    private static FeedbackTensor.ProposedRepairAction action(RepairRequest request, RepairResult result) {
        return switch (result.decision()) {
            case REPAIRED -> new FeedbackTensor.ProposedRepairAction(ProposedAction.RETRY_WITH_PATCH,
                    result.detail(), false, request.target(), result.repairedExcerpt());
            case ESCALATE -> new FeedbackTensor.ProposedRepairAction(ProposedAction.REQUEST_MANUAL_REVIEW,
                    result.detail(), true, request.target(), null);
            case STOP -> new FeedbackTensor.ProposedRepairAction(ProposedAction.ABORT,
                    result.detail(), false, request.target(), null);
        };
    }

    private static TraceInspectionEntry.RepairSummary toSummary(RepairResult result) {
        return new TraceInspectionEntry.RepairSummary(
                result.decision().wireValue(),
                result.continuationAllowed(),
                result.reasonCode(),
                result.detail(),
                result.attempts(),
                result.maxAttempts(),
                result.appliedRuleId(),
                result.repairedExcerpt(),
                result.history().stream()
                        .map(a -> new TraceInspectionEntry.RepairAttemptRecord(a.attempt(), a.ruleId(),
                                a.outcome().wireValue(), a.reasonCode(), a.detail()))
                        .toList());
    }
}
