package com.lsemantica.core.trace;

/**
 * One trace ledger line per governed runtime invocation.
 */
public record TraceLedgerEntry(
        String schemaVersion,
        String runId,
        String startedAt,
        String completedAt,
        ContractVersions contractVersions,
        Outcome outcome
) {

    public static final String SCHEMA_VERSION = "0.1.0";

    public record ContractVersions(String semanticIr, String policyProfile) {}

    /**
     * @param status {@code success} or {@code failure}
     * @param error  present only on failure
     */
    public record Outcome(String status, TraceError error) {

        public static Outcome success() {
            return new Outcome("success", null);
        }

        public static Outcome failure(TraceError error) {
            return new Outcome("failure", error);
        }
    }
}
