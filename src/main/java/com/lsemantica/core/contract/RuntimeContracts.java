package com.lsemantica.core.contract;

/**
 * Contracts bundled for one runtime invocation.
 *
 * @param verificationContract optional; {@code null} means the continuation gate is bypassed
 */
public record RuntimeContracts(SemanticIrContract semanticIr, PolicyProfileContract policyProfile,
                               VerificationContract verificationContract) {

    public boolean hasVerificationContract() {
        return verificationContract != null;
    }
}
