package com.lsemantica.core.gate;

public enum GateReasonCode {
    CONTINUATION_GATE_NOT_CONFIGURED,
    VERIFICATION_GATE_PASSED,
    POLICY_PROFILE_REQUIRED,
    VERIFICATION_REQUIRED_FEEDBACK_MISSING,
    VERIFICATION_POLICY_ASSERTION_FAILED,
    VERIFICATION_REQUIRED_CHECKS_BELOW_THRESHOLD
}
