package com.lsemantica.core.reliability;

import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.repair.RepairDecision;

import java.util.List;

/**
 * Outcome of replaying the reliability corpus through the repair loop and scoring it against
 * the gate thresholds.
 */
public record ReliabilityGateReport(
        String schemaVersion,
        String generatedAt,
        String corpusId,
        String corpusSchemaVersion,
        ReliabilityThresholds thresholds,
        int fixtureCount,
        List<FixtureResult> results,
        Aggregate aggregate,
        List<ClassSummary> byFailureClass
) {

    public static final String SCHEMA_VERSION = "0.1.0";
    /** Fixed so reports over the same corpus are byte-identical. */
    public static final String GENERATED_AT = "2026-02-22T00:00:00.000Z";

    public ReliabilityGateReport {
        results = List.copyOf(results);
        byFailureClass = List.copyOf(byFailureClass);
    }

    public boolean gatePass() {
        return aggregate.gates().pass();
    }

    public record FixtureResult(
            String fixtureId,
            FailureClass failureClass,
            Recoverability recoverability,
            ExpectedOutcome expected,
            ObservedOutcome observed,
            Checks checks
    ) {}

    public record ExpectedOutcome(FailureClass classification, boolean continuationAllowed) {}

    public record ObservedOutcome(
            FailureClass classification,
            RepairDecision decision,
            String reasonCode,
            boolean continuationAllowed
    ) {}

    public record Checks(
            boolean classificationMatches,
            boolean recovered,
            boolean blockedUnsafeContinuation,
            boolean unsafeContinuationAllowed,
            boolean allowedCompliantContinuation,
            boolean compliantContinuationBlocked
    ) {}

    public record Aggregate(
            Recovery recovery,
            SafeContinuation safeContinuation,
            Classification classification,
            Gates gates
    ) {}

    public record Recovery(
            int recoverableFixtureCount,
            int recoveredFixtureCount,
            double recoveryRate,
            double threshold,
            boolean pass
    ) {}

    public record SafeContinuation(
            int nonRecoverableFixtureCount,
            int blockedUnsafeContinuationCount,
            int unsafeContinuationAllowedCount,
            double safeBlockRate,
            double safeBlockRateThreshold,
            boolean safeBlockRatePass,
            int recoverableFixtureCount,
            int allowedCompliantContinuationCount,
            int compliantContinuationBlockedCount,
            double safeAllowRate,
            double safeAllowRateThreshold,
            boolean safeAllowRatePass
    ) {}

    public record Classification(int fixtureCount, int matchCount, int mismatchCount, double matchRate) {}

    public record Gates(boolean pass, List<String> failedMetrics) {

        public Gates {
            failedMetrics = List.copyOf(failedMetrics);
        }
    }

    public record ClassSummary(
            FailureClass failureClass,
            int fixtureCount,
            int recoverableFixtureCount,
            int nonRecoverableFixtureCount,
            int recoveredFixtureCount,
            int blockedUnsafeContinuationCount,
            int unsafeContinuationAllowedCount,
            int allowedCompliantContinuationCount,
            int compliantContinuationBlockedCount,
            double recoveryRate,
            double safeBlockRate,
            double safeAllowRate
    ) {}
}
