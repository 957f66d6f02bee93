package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.model.Decision;

import java.util.List;

/**
 * Validated VerificationContract: required checks, pass criteria and continuation behaviour.
 */
public record VerificationContract(
        String schemaVersion,
        String contractId,
        List<CheckRequirement> tests,
        List<CheckRequirement> staticAnalysis,
        List<PolicyAssertion> policyAssertions,
        PassCriteria passCriteria,
        Continuation continuation,
        JsonNode document
) {

    public VerificationContract {
        tests = List.copyOf(tests);
        staticAnalysis = List.copyOf(staticAnalysis);
        policyAssertions = List.copyOf(policyAssertions);
    }

    public record CheckRequirement(String id, boolean required) {}

    public record PolicyAssertion(String id, String policyPath, JsonNode expected, boolean required) {}

    public record PassCriteria(double minimumRequiredChecksPassRatio, int maxWarningCount,
                               boolean requireAllPolicyAssertions) {}

    public record Continuation(Decision onSuccess, Decision onFailure, boolean requirePolicyProfile,
                               List<String> requiredFeedbackTensorFields) {

        public Continuation {
            requiredFeedbackTensorFields = List.copyOf(requiredFeedbackTensorFields);
        }
    }
}
