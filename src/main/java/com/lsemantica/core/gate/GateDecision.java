package com.lsemantica.core.gate;

import com.lsemantica.core.model.Decision;

import java.util.List;

/**
 * Outcome of one continuation gate evaluation.
 */
public record GateDecision(
        Decision decision,
        boolean continuationAllowed,
        GateReasonCode reasonCode,
        String detail,
        int requiredChecksPassed,
        int requiredChecksTotal,
        double requiredChecksPassRatio,
        int warningCount,
        int maxWarningCount,
        List<String> missingFeedbackFields,
        List<String> failedPolicyAssertionIds
) {

    public GateDecision {
        missingFeedbackFields = List.copyOf(missingFeedbackFields);
        failedPolicyAssertionIds = List.copyOf(failedPolicyAssertionIds);
    }
}
