package com.lsemantica.core.repair;

import com.lsemantica.core.trace.GovernanceHooks;

import java.nio.file.Path;

/**
 * Per-run repair options. Every sink path is optional; hooks are only consulted when at
 * least one sink is set.
 *
 * @param maxAttempts attempt budget, {@code null} for the default of {@value RepairLoop#DEFAULT_MAX_ATTEMPTS}
 */
public record RepairOptions(
        Integer maxAttempts,
        Path feedbackTensorPath,
        Path traceInspectionPath,
        Path traceInspectionReportPath,
        String runId,
        String traceEntryId,
        GovernanceHooks hooks
) {

    public static RepairOptions defaults() {
        return new RepairOptions(null, null, null, null, null, null, GovernanceHooks.defaults());
    }

    public RepairOptions withMaxAttempts(Integer maxAttempts) {
        return new RepairOptions(maxAttempts, feedbackTensorPath, traceInspectionPath, traceInspectionReportPath,
                runId, traceEntryId, hooks);
    }

    public RepairOptions withFeedbackTensorPath(Path path) {
        return new RepairOptions(maxAttempts, path, traceInspectionPath, traceInspectionReportPath,
                runId, traceEntryId, hooks);
    }

    public RepairOptions withTraceInspection(Path entryPath, Path reportPath) {
        return new RepairOptions(maxAttempts, feedbackTensorPath, entryPath, reportPath,
                runId, traceEntryId, hooks);
    }

    public RepairOptions withRunId(String runId) {
        return new RepairOptions(maxAttempts, feedbackTensorPath, traceInspectionPath, traceInspectionReportPath,
                runId, traceEntryId, hooks);
    }

    public RepairOptions withTraceEntryId(String traceEntryId) {
        return new RepairOptions(maxAttempts, feedbackTensorPath, traceInspectionPath, traceInspectionReportPath,
                runId, traceEntryId, hooks);
    }

    public RepairOptions withHooks(GovernanceHooks hooks) {
        return new RepairOptions(maxAttempts, feedbackTensorPath, traceInspectionPath, traceInspectionReportPath,
                runId, traceEntryId, hooks);
    }

    boolean emitsInspection() {
        return traceInspectionPath != null || traceInspectionReportPath != null;
    }

    boolean emitsAnything() {
        return feedbackTensorPath != null || emitsInspection();
    }

    GovernanceHooks hooksOrDefaults() {
        return hooks != null ? hooks : GovernanceHooks.defaults();
    }
}
