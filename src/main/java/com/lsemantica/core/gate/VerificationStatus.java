package com.lsemantica.core.gate;

import java.util.List;

/**
 * Observed verification results for one candidate continuation.
 */
public record VerificationStatus(List<CheckResult> checks, int warningCount) {

    public VerificationStatus {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public record CheckResult(String id, CheckKind kind, boolean passed) {

        /** Lookup key used to match a result against a requirement, e.g. {@code test:unit}. */
        public String key() {
            return kind.wireValue() + ":" + id;
        }
    }
}
