package com.lsemantica.core.pipeline.patch;

/**
 * Outcome of one verification check. A result without {@code evidenceRef} counts as incomplete
 * evidence even when it passed.
 */
public record VerificationResult(String check, CheckStatus status, String evidenceRef, String detail) {

    public static VerificationResult passed(String check, String evidenceRef) {
        return new VerificationResult(check, CheckStatus.PASS, evidenceRef, null);
    }

    public static VerificationResult failed(String check, String evidenceRef, String detail) {
        return new VerificationResult(check, CheckStatus.FAIL, evidenceRef, detail);
    }
}
