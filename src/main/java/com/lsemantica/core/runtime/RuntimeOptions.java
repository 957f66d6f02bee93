package com.lsemantica.core.runtime;

import com.lsemantica.core.gate.GateInput;
import com.lsemantica.core.trace.GovernanceHooks;

import java.nio.file.Path;

/**
 * Runtime invocation options.
 *
 * @param continuationGate gate evidence; {@code null} bypasses the gate
 */
public record RuntimeOptions(
        Path traceLedgerPath,
        Path feedbackTensorPath,
        Path traceInspectionPath,
        Path traceInspectionReportPath,
        GateInput continuationGate,
        GovernanceHooks hooks
) {

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(null, null, null, null, null, GovernanceHooks.defaults());
    }

    public RuntimeOptions withTraceLedgerPath(Path path) {
        return new RuntimeOptions(path, feedbackTensorPath, traceInspectionPath, traceInspectionReportPath,
                continuationGate, hooks);
    }

    public RuntimeOptions withFeedbackTensorPath(Path path) {
        return new RuntimeOptions(traceLedgerPath, path, traceInspectionPath, traceInspectionReportPath,
                continuationGate, hooks);
    }

    public RuntimeOptions withTraceInspection(Path entryPath, Path reportPath) {
        return new RuntimeOptions(traceLedgerPath, feedbackTensorPath, entryPath, reportPath,
                continuationGate, hooks);
    }

    public RuntimeOptions withContinuationGate(GateInput gate) {
        return new RuntimeOptions(traceLedgerPath, feedbackTensorPath, traceInspectionPath,
                traceInspectionReportPath, gate, hooks);
    }

    public RuntimeOptions withHooks(GovernanceHooks hooks) {
        return new RuntimeOptions(traceLedgerPath, feedbackTensorPath, traceInspectionPath,
                traceInspectionReportPath, continuationGate, hooks);
    }

    boolean emitsInspection() {
        return traceInspectionPath != null || traceInspectionReportPath != null;
    }

    boolean emitsAnything() {
        return traceLedgerPath != null || feedbackTensorPath != null || emitsInspection();
    }

    GovernanceHooks hooksOrDefaults() {
        return hooks != null ? hooks : GovernanceHooks.defaults();
    }
}
