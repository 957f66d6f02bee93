package com.lsemantica.core.trace;

import com.lsemantica.core.model.WireValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link TraceInspectionEntry} as the fixed-layout text report. Absent values print
 * as {@code n/a}, booleans as {@code yes}/{@code no}.
 */
public final class TraceInspectionReport {

    private TraceInspectionReport() {}

    public static String format(TraceInspectionEntry entry) {
        List<String> lines = new ArrayList<>();
        lines.add("[Trace Inspection]");
        lines.add("Run ID: " + entry.runId());
        lines.add("Started At: " + entry.startedAt());
        lines.add("Completed At: " + entry.completedAt());
        lines.add("Generated At: " + entry.generatedAt());

        TraceInspectionEntry.Invocation invocation = entry.invocation();
        lines.add("Invocation Status: " + invocation.status());
        if (invocation.succeeded()) {
            lines.add("Trace ID: " + invocation.traceId());
        } else {
            lines.add("Failure Code: " + invocation.failureCode());
            lines.add("Failure Error: " + invocation.error().name() + ": " + invocation.error().message());
        }

        TraceInspectionEntry.GateSummary gate = entry.continuationGate();
        if (gate != null) {
            lines.add("Continuation Gate Configured: " + yesNo(gate.configured()));
            lines.add("Continuation Decision: " + gate.decision().wireValue() + " (" + gate.reasonCode() + ")");
            lines.add("Continuation Allowed: " + yesNo(gate.continuationAllowed()));
            lines.add("Continuation Detail: " + gate.detail());
        } else {
            lines.add("Continuation Gate: n/a");
        }

        TraceInspectionEntry.RepairSummary repair = entry.repair();
        if (repair != null) {
            lines.add("Repair Decision: " + repair.decision() + " (" + repair.reasonCode() + ")");
            lines.add("Repair Continuation Allowed: " + yesNo(repair.continuationAllowed()));
            lines.add("Repair Attempts: " + repair.attempts() + "/" + repair.maxAttempts());
            lines.add("Repair Applied Rule: " + optional(repair.appliedRuleId()));
            lines.add("Repair Detail: " + repair.detail());
            lines.add("Repair Repaired Excerpt: " + optional(repair.repairedExcerpt()));
            if (repair.history().isEmpty()) {
                lines.add("Repair History: none");
            } else {
                lines.add("Repair History:");
                for (TraceInspectionEntry.RepairAttemptRecord record : repair.history()) {
                    lines.add("  - #" + record.attempt() + " " + record.ruleId() + ": " + record.outcome()
                            + " (" + record.reasonCode() + ") " + record.detail());
                }
            }
        } else {
            lines.add("Repair Decision: n/a");
        }

        TraceInspectionEntry.LedgerSummary ledger = entry.traceLedger();
        lines.add("Trace Ledger Configured: " + yesNo(ledger.configured()));
        lines.add("Trace Ledger Emitted: " + yesNo(ledger.emitted()));
        lines.add("Trace Ledger Entry ID: " + optional(ledger.traceEntryId()));
        lines.add("Trace Ledger Path: " + optional(ledger.outputPath()));

        TraceInspectionEntry.FeedbackSummary feedback = entry.feedbackTensor();
        TraceInspectionEntry.SignalSummary signal = feedback.failureSignal();
        lines.add("FeedbackTensor Configured: " + yesNo(feedback.configured()));
        lines.add("FeedbackTensor Emitted: " + yesNo(feedback.emitted()));
        lines.add("FeedbackTensor ID: " + optional(feedback.feedbackId()));
        lines.add("FeedbackTensor Trace Entry ID: " + optional(feedback.traceEntryId()));
        lines.add("FeedbackTensor Class: " + optional(signal == null ? null : signal.failureClass()));
        lines.add("FeedbackTensor Stage: " + optional(signal == null ? null : signal.stage()));
        if (feedback.confidence() != null) {
            lines.add("FeedbackTensor Confidence: " + formatScore(feedback.confidence().score())
                    + " (" + optional(feedback.confidence().calibrationBand()) + ")");
            lines.add("FeedbackTensor Confidence Rationale: " + feedback.confidence().rationale());
        } else {
            lines.add("FeedbackTensor Confidence: n/a (n/a)");
            lines.add("FeedbackTensor Confidence Rationale: n/a");
        }
        TraceInspectionEntry.ActionSummary action = feedback.proposedRepairAction();
        lines.add("FeedbackTensor Proposed Action: " + optional(action == null ? null : action.action()));
        lines.add("FeedbackTensor Path: " + optional(feedback.outputPath()));

        return String.join("\n", lines);
    }

    static String formatScore(double score) {
        return BigDecimal.valueOf(score).stripTrailingZeros().toPlainString();
    }

    private static String optional(String value) {
        return value == null ? "n/a" : value;
    }

    private static String optional(WireValue value) {
        return value == null ? "n/a" : value.wireValue();
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
