package com.lsemantica.core.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.contract.ContractName;
import com.lsemantica.core.contract.ContractValidationException;
import com.lsemantica.core.feedback.FailureStage;
import com.lsemantica.core.feedback.FeedbackTensor;
import com.lsemantica.core.feedback.FeedbackTensorFactory;
import com.lsemantica.core.feedback.ProposedAction;
import com.lsemantica.core.feedback.SourceStage;
import com.lsemantica.core.gate.ContinuationGate;
import com.lsemantica.core.gate.GateDecision;
import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.trace.GovernanceHooks;
import com.lsemantica.core.trace.HookResolver;
import com.lsemantica.core.trace.NdjsonSink;
import com.lsemantica.core.trace.TraceError;
import com.lsemantica.core.trace.TraceInspectionEntry;
import com.lsemantica.core.trace.TraceInspectionReport;
import com.lsemantica.core.trace.TraceLedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Executes a SemanticIR envelope under the continuation gate.
 * <p>
 * Every invocation, successful or not, is recorded in the configured trace sinks. Failures
 * are rethrown unchanged after they are recorded; a non-{@code continue} gate decision is
 * raised as {@link RuntimeContinuationGateException}.
 */
@Service
public class SemanticIrRunner {

    private static final Logger log = LoggerFactory.getLogger(SemanticIrRunner.class);

    private final ContinuationGate gate;
    private final NdjsonSink sink;

    public SemanticIrRunner(ContinuationGate gate, NdjsonSink sink) {
        this.gate = gate;
        this.sink = sink;
    }

    public RuntimeResult run(JsonNode ir) {
        return run(ir, RuntimeOptions.defaults());
    }

    public RuntimeResult run(JsonNode ir, RuntimeOptions options) {
        RuntimeOptions effective = options != null ? options : RuntimeOptions.defaults();
        GovernanceHooks hooks = effective.hooksOrDefaults();
        String runId = effective.emitsAnything() ? HookResolver.resolveRunId(null, hooks.runIdFactory(), null) : null;
        String startedAt = effective.emitsAnything() ? HookResolver.resolveTimestamp(hooks.clock()) : null;

        RuntimeResult result = null;
        GateDecision gateDecision = null;
        RuntimeException failure = null;
        try {
            if (ir == null || !ir.isObject()) {
                throw new IllegalArgumentException("SemanticIR input must be an object");
            }
            String version = requireText(ir, "version", "SemanticIR version is required");
            requireText(ir, "goal", "SemanticIR goal is required");

            gateDecision = effective.continuationGate() != null
                    ? gate.evaluate(effective.continuationGate())
                    : gate.bypass();
            if (!gateDecision.continuationAllowed()) {
                throw new RuntimeContinuationGateException(gateDecision);
            }
            result = new RuntimeResult(true, "trace-" + version, gateDecision);
            log.info("SemanticIR {} executed under {}", result.traceId(), gateDecision.reasonCode());
            return result;
        } catch (RuntimeException e) {
            failure = e;
            log.info("SemanticIR invocation failed: {}", e.getMessage());
            throw e;
        } finally {
            // an Error leaves neither a result nor a failure to record
            if (effective.emitsAnything() && (result != null || failure != null)) {
                record(effective, hooks, runId, startedAt, result, gateDecision, failure);
            }
        }
    }

    private void record(RuntimeOptions options, GovernanceHooks hooks, String runId, String startedAt,
                        RuntimeResult result, GateDecision gateDecision, RuntimeException failure) {
        String completedAt = HookResolver.resolveTimestamp(hooks.clock());
        TraceError error = failure == null ? null : TraceError.of(failure);

        boolean ledgerEmitted = false;
        if (options.traceLedgerPath() != null) {
            TraceLedgerEntry entry = new TraceLedgerEntry(
                    TraceLedgerEntry.SCHEMA_VERSION,
                    runId,
                    startedAt,
                    completedAt,
                    new TraceLedgerEntry.ContractVersions(ContractName.SEMANTIC_IR.supportedVersion(),
                            ContractName.POLICY_PROFILE.supportedVersion()),
                    error == null ? TraceLedgerEntry.Outcome.success() : TraceLedgerEntry.Outcome.failure(error));
            ledgerEmitted = sink.appendRecord(options.traceLedgerPath(), entry, "trace-ledger");
        }
        String traceEntryId = options.traceLedgerPath() != null ? runId : null;

        TraceInspectionEntry.FeedbackSummary feedback = TraceInspectionEntry.FeedbackSummary.notConfigured();
        if (options.feedbackTensorPath() != null && failure != null) {
            FeedbackTensor tensor = failureFeedback(failure, hooks, runId, traceEntryId);
            boolean emitted = sink.appendRecord(options.feedbackTensorPath(), tensor, "feedback-tensor");
            feedback = TraceInspectionEntry.FeedbackSummary.of(tensor, emitted, options.feedbackTensorPath().toString());
        } else if (options.feedbackTensorPath() != null) {
            feedback = new TraceInspectionEntry.FeedbackSummary(true, false, options.feedbackTensorPath().toString(),
                    null, traceEntryId, null, null, null);
        }

        if (!options.emitsInspection()) {
            return;
        }
        TraceInspectionEntry inspection = new TraceInspectionEntry(
                TraceInspectionEntry.SCHEMA_VERSION,
                runId,
                startedAt,
                completedAt,
                completedAt,
                failure == null
                        ? TraceInspectionEntry.Invocation.success(result.traceId())
                        : TraceInspectionEntry.Invocation.failure(errorCode(failure), error),
                gateDecision == null ? null : new TraceInspectionEntry.GateSummary(
                        options.continuationGate() != null, gateDecision.decision(),
                        gateDecision.continuationAllowed(), gateDecision.reasonCode().name(), gateDecision.detail()),
                null,
                new TraceInspectionEntry.LedgerSummary(options.traceLedgerPath() != null, ledgerEmitted,
                        options.traceLedgerPath() == null ? null : options.traceLedgerPath().toString(), traceEntryId),
                feedback);
        sink.appendRecord(options.traceInspectionPath(), inspection, "trace-inspection");
        sink.appendText(options.traceInspectionReportPath(), TraceInspectionReport.format(inspection),
                "trace-inspection-report");
    }

    static FeedbackTensor failureFeedback(RuntimeException failure, GovernanceHooks hooks, String runId,
                                          String traceEntryId) {
        boolean schemaFailure = failure instanceof ContractValidationException;
        boolean gateFailure = failure instanceof RuntimeContinuationGateException;
        FailureClass failureClass = schemaFailure ? FailureClass.SCHEMA_CONTRACT
                : gateFailure ? FailureClass.POLICY_GATE
                : FailureClass.DETERMINISTIC_RUNTIME;
        FeedbackTensor.Confidence confidence = schemaFailure
                ? new FeedbackTensor.Confidence(0.9,
                        "Failure matched a schema contract violation with deterministic evidence.", CalibrationBand.HIGH)
                : new FeedbackTensor.Confidence(0.7,
                        "Runtime failure was captured without a deterministic repair signal.", CalibrationBand.MEDIUM);

        return FeedbackTensorFactory.create(new FeedbackTensor(
                FeedbackTensor.SCHEMA_VERSION,
                HookResolver.resolveFeedbackId(hooks.feedbackIdFactory(), runId),
                HookResolver.resolveTimestamp(hooks.clock()),
                new FeedbackTensor.FailureSignal(failureClass, gateFailure ? FailureStage.POLICY : FailureStage.RUNTIME,
                        failure.getMessage(), false, errorCode(failure)),
                confidence,
                List.of(),
                new FeedbackTensor.ProposedRepairAction(ProposedAction.REQUEST_MANUAL_REVIEW,
                        "Runtime invocation failed; route the captured error to a reviewer.", true,
                        "runtime.semantic_ir", null),
                new FeedbackTensor.Provenance(runId, gateFailure ? SourceStage.POLICY_GATE : SourceStage.RUNTIME,
                        traceEntryId,
                        new FeedbackTensor.ContractVersions(ContractName.SEMANTIC_IR.supportedVersion(),
                                ContractName.POLICY_PROFILE.supportedVersion(), FeedbackTensor.SCHEMA_VERSION))));
    }

    static String errorCode(RuntimeException failure) {
        if (failure instanceof ContractValidationException contractFailure) {
            return contractFailure.code().name();
        }
        if (failure instanceof RuntimeContinuationGateException gateFailure) {
            return gateFailure.decision().reasonCode().name();
        }
        return "RUNTIME_INVOCATION_FAILED";
    }

    private static String requireText(JsonNode ir, String field, String message) {
        JsonNode value = ir.get(field);
        if (value == null || !value.isTextual() || value.asText().trim().isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        return value.asText().trim();
    }
}
