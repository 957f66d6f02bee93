package com.lsemantica.core.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.model.FailureClass;

import java.util.List;

/**
 * FeedbackTensor v1 record. Instances written to a sink should come from
 * {@link FeedbackTensorFactory#create}, which applies the documented fallbacks.
 */
public record FeedbackTensor(
        String schemaVersion,
        String feedbackId,
        String generatedAt,
        FailureSignal failureSignal,
        Confidence confidence,
        List<Alternative> alternatives,
        ProposedRepairAction proposedRepairAction,
        Provenance provenance
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public record FailureSignal(
            @JsonProperty("class") FailureClass failureClass,
            FailureStage stage,
            String summary,
            boolean continuationAllowed,
            String errorCode
    ) {}

    public record Confidence(double score, String rationale, CalibrationBand calibrationBand) {}

    public record Alternative(String id, String hypothesis, String expectedOutcome,
                              Double estimatedSuccessProbability) {}

    public record ProposedRepairAction(ProposedAction action, String rationale, boolean requiresHumanApproval,
                                       String target, String patchExcerpt) {}

    public record Provenance(String runId, SourceStage sourceStage, String traceEntryId,
                             ContractVersions contractVersions) {}

    public record ContractVersions(String semanticIr, String policyProfile, String feedbackTensor) {}
}
