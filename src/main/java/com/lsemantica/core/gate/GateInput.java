package com.lsemantica.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.contract.PolicyProfileContract;
import com.lsemantica.core.contract.VerificationContract;
import com.lsemantica.core.feedback.FeedbackTensor;
import com.lsemantica.core.json.CanonicalJson;

/**
 * Evidence handed to the continuation gate. Everything except the verification contract
 * is optional.
 *
 * @param feedbackTensor FeedbackTensor evidence as JSON, so absent fields can be detected
 */
public record GateInput(
        VerificationContract verificationContract,
        PolicyProfileContract policyProfile,
        VerificationStatus verificationStatus,
        JsonNode feedbackTensor
) {

    public static GateInput of(VerificationContract verificationContract) {
        return new GateInput(verificationContract, null, null, null);
    }

    public GateInput withPolicyProfile(PolicyProfileContract profile) {
        return new GateInput(verificationContract, profile, verificationStatus, feedbackTensor);
    }

    public GateInput withVerificationStatus(VerificationStatus status) {
        return new GateInput(verificationContract, policyProfile, status, feedbackTensor);
    }

    public GateInput withFeedbackTensor(JsonNode evidence) {
        return new GateInput(verificationContract, policyProfile, verificationStatus, evidence);
    }

    public GateInput withFeedbackTensor(FeedbackTensor tensor) {
        return withFeedbackTensor(tensor == null ? null : CanonicalJson.toTree(tensor));
    }
}
