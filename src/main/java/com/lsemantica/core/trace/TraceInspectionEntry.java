package com.lsemantica.core.trace;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lsemantica.core.feedback.FailureStage;
import com.lsemantica.core.feedback.FeedbackTensor;
import com.lsemantica.core.feedback.ProposedAction;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.model.FailureClass;

import java.util.List;

/**
 * Inspection record correlating one invocation with its gate, repair, ledger and
 * FeedbackTensor outcomes. Optional sections are omitted from the JSON when {@code null}.
 */
public record TraceInspectionEntry(
        String schemaVersion,
        String runId,
        String startedAt,
        String completedAt,
        String generatedAt,
        Invocation invocation,
        GateSummary continuationGate,
        RepairSummary repair,
        LedgerSummary traceLedger,
        FeedbackSummary feedbackTensor
) {

    public static final String SCHEMA_VERSION = "0.1.0";

    public record Invocation(String status, String traceId, String failureCode, TraceError error) {

        public static Invocation success(String traceId) {
            return new Invocation("success", traceId, null, null);
        }

        public static Invocation failure(String failureCode, TraceError error) {
            return new Invocation("failure", null, failureCode, error);
        }

        public boolean succeeded() {
            return "success".equals(status);
        }
    }

    public record GateSummary(boolean configured, Decision decision, boolean continuationAllowed,
                              String reasonCode, String detail) {}

    public record RepairSummary(String decision, boolean continuationAllowed, String reasonCode, String detail,
                                int attempts, int maxAttempts, String appliedRuleId, String repairedExcerpt,
                                List<RepairAttemptRecord> history) {}

    public record RepairAttemptRecord(int attempt, String ruleId, String outcome, String reasonCode,
                                      String detail) {}

    public record LedgerSummary(boolean configured, boolean emitted, String outputPath, String traceEntryId) {}

    public record FeedbackSummary(boolean configured, boolean emitted, String outputPath, String feedbackId,
                                  String traceEntryId, SignalSummary failureSignal,
                                  FeedbackTensor.Confidence confidence, ActionSummary proposedRepairAction) {

        public static FeedbackSummary notConfigured() {
            return new FeedbackSummary(false, false, null, null, null, null, null, null);
        }

        public static FeedbackSummary of(FeedbackTensor tensor, boolean emitted, String outputPath) {
            FeedbackTensor.FailureSignal signal = tensor.failureSignal();
            FeedbackTensor.ProposedRepairAction action = tensor.proposedRepairAction();
            return new FeedbackSummary(true, emitted, outputPath, tensor.feedbackId(),
                    tensor.provenance().traceEntryId(),
                    new SignalSummary(signal.failureClass(), signal.stage(), signal.continuationAllowed(),
                            signal.errorCode()),
                    tensor.confidence(),
                    new ActionSummary(action.action(), action.requiresHumanApproval(), action.target()));
        }
    }

    public record SignalSummary(@JsonProperty("class") FailureClass failureClass, FailureStage stage,
                                boolean continuationAllowed, String errorCode) {}

    public record ActionSummary(ProposedAction action, boolean requiresHumanApproval, String target) {}
}
