package com.lsemantica.core.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/**
 * Reason codes shared by the decision-making pipeline stages. Each stage accepts the prefix of
 * this list that its schema version pins; see {@link #allowedIn(ArtifactType)}.
 */
public enum ReasonCode implements WireValue {
    OK("ok"),
    UNSUPPORTED_INPUT("unsupported_input"),
    MAPPING_AMBIGUOUS("mapping_ambiguous"),
    MAPPING_LOW_CONFIDENCE("mapping_low_confidence"),
    FORBIDDEN_PATH("forbidden_path"),
    CHANGE_BOUND_EXCEEDED("change_bound_exceeded"),
    CONFLICT_DETECTED("conflict_detected"),
    POLICY_BLOCKED("policy_blocked"),
    VERIFICATION_FAILED("verification_failed"),
    VERIFICATION_INCOMPLETE("verification_incomplete"),
    ROLLBACK_UNAVAILABLE("rollback_unavailable"),
    BUNDLE_INCOMPLETE("bundle_incomplete");

    private final String wireValue;

    ReasonCode(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean allowedIn(ArtifactType type) {
        return switch (type) {
            case WORKSPACE_SNAPSHOT -> false;
            case INTENT_MAPPING -> ordinal() <= MAPPING_LOW_CONFIDENCE.ordinal();
            case SAFE_DIFF_PLAN -> ordinal() <= POLICY_BLOCKED.ordinal();
            case PATCH_RUN -> ordinal() <= VERIFICATION_INCOMPLETE.ordinal();
            case PR_BUNDLE -> true;
        };
    }

    @JsonCreator
    public static ReasonCode fromWire(String value) {
        return WireValue.parse(ReasonCode.class, value, "reason_code");
    }
}
