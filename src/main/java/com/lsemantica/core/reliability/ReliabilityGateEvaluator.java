package com.lsemantica.core.reliability;

import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.repair.RepairDecision;
import com.lsemantica.core.repair.RepairLoop;
import com.lsemantica.core.repair.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Replays every corpus fixture through the repair loop with default options and scores the
 * outcomes.
 * <p>
 * Three gate rates are computed: recovery rate over recoverable fixtures, safe block rate over
 * non-recoverable fixtures, and safe allow rate over recoverable fixtures. A rate with an empty
 * denominator is {@code 0}. The gates pass when each rate reaches its threshold.
 */
@Service
public class ReliabilityGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityGateEvaluator.class);

    public static final String RECOVERY_RATE = "recovery_rate";
    public static final String SAFE_BLOCK_RATE = "safe_block_rate";
    public static final String SAFE_ALLOW_RATE = "safe_allow_rate";

    private final RepairLoop repairLoop;
    private final ReliabilityCorpusLoader loader;

    public ReliabilityGateEvaluator(RepairLoop repairLoop, ReliabilityCorpusLoader loader) {
        this.repairLoop = repairLoop;
        this.loader = loader;
    }

    /**
     * @throws ReliabilityCorpusException when the thresholds target another corpus version or
     *                                    a failure class lacks recoverable or non-recoverable fixtures
     */
    public ReliabilityGateReport evaluate(ReliabilityCorpus corpus, ReliabilityThresholds thresholds) {
        loader.checkGateCompatibility(corpus, thresholds);

        List<ReliabilityGateReport.FixtureResult> results = corpus.fixtures().stream()
                .map(this::evaluateFixture)
                .toList();
        ReliabilityGateReport.Aggregate aggregate = aggregate(results, thresholds.metrics());

        log.info("Reliability gates for corpus {}: {} over {} fixture(s){}", corpus.corpusId(),
                aggregate.gates().pass() ? "pass" : "fail", results.size(),
                aggregate.gates().pass() ? "" : " (failed " + String.join(", ", aggregate.gates().failedMetrics()) + ")");

        return new ReliabilityGateReport(
                ReliabilityGateReport.SCHEMA_VERSION,
                ReliabilityGateReport.GENERATED_AT,
                corpus.corpusId(),
                corpus.schemaVersion(),
                thresholds,
                results.size(),
                results,
                aggregate,
                byFailureClass(results));
    }

    ReliabilityGateReport.FixtureResult evaluateFixture(ReliabilityCorpus.Fixture fixture) {
        RepairResult observed = repairLoop.run(fixture.toRepairRequest());
        log.debug("Fixture {} -> {} ({})", fixture.id(), observed.decision().wireValue(), observed.reasonCode());

        boolean expectedAllowed = fixture.expected().continuationAllowed();
        boolean observedAllowed = observed.continuationAllowed();
        boolean recoverable = fixture.recoverable();

        ReliabilityGateReport.Checks checks = new ReliabilityGateReport.Checks(
                observed.classification() == fixture.expected().classification(),
                recoverable && observed.decision() == RepairDecision.REPAIRED,
                !recoverable && !expectedAllowed && !observedAllowed,
                !recoverable && !expectedAllowed && observedAllowed,
                recoverable && expectedAllowed && observedAllowed,
                recoverable && expectedAllowed && !observedAllowed);

        return new ReliabilityGateReport.FixtureResult(
                fixture.id(),
                fixture.failureClass(),
                fixture.recoverability(),
                new ReliabilityGateReport.ExpectedOutcome(fixture.expected().classification(), expectedAllowed),
                new ReliabilityGateReport.ObservedOutcome(observed.classification(), observed.decision(),
                        observed.reasonCode(), observedAllowed),
                checks);
    }

    static ReliabilityGateReport.Aggregate aggregate(List<ReliabilityGateReport.FixtureResult> results,
                                                     ReliabilityThresholds.Metrics thresholds) {
        List<ReliabilityGateReport.FixtureResult> recoverable = results.stream()
                .filter(r -> r.recoverability() == Recoverability.RECOVERABLE).toList();
        List<ReliabilityGateReport.FixtureResult> nonRecoverable = results.stream()
                .filter(r -> r.recoverability() == Recoverability.NON_RECOVERABLE).toList();

        int recovered = count(recoverable, c -> c.recovered());
        int blockedUnsafe = count(nonRecoverable, c -> c.blockedUnsafeContinuation());
        int unsafeAllowed = count(nonRecoverable, c -> c.unsafeContinuationAllowed());
        int allowedCompliant = count(recoverable, c -> c.allowedCompliantContinuation());
        int compliantBlocked = count(recoverable, c -> c.compliantContinuationBlocked());
        int matches = count(results, c -> c.classificationMatches());

        double recoveryRate = safeRate(recovered, recoverable.size());
        double safeBlockRate = safeRate(blockedUnsafe, nonRecoverable.size());
        double safeAllowRate = safeRate(allowedCompliant, recoverable.size());

        boolean recoveryPass = recoveryRate >= thresholds.recoveryRate();
        boolean safeBlockPass = safeBlockRate >= thresholds.safeBlockRate();
        boolean safeAllowPass = safeAllowRate >= thresholds.safeAllowRate();
        List<String> failedMetrics = new ArrayList<>();
        if (!recoveryPass) {
            failedMetrics.add(RECOVERY_RATE);
        }
        if (!safeBlockPass) {
            failedMetrics.add(SAFE_BLOCK_RATE);
        }
        if (!safeAllowPass) {
            failedMetrics.add(SAFE_ALLOW_RATE);
        }

        return new ReliabilityGateReport.Aggregate(
                new ReliabilityGateReport.Recovery(recoverable.size(), recovered, recoveryRate,
                        thresholds.recoveryRate(), recoveryPass),
                new ReliabilityGateReport.SafeContinuation(
                        nonRecoverable.size(), blockedUnsafe, unsafeAllowed,
                        safeBlockRate, thresholds.safeBlockRate(), safeBlockPass,
                        recoverable.size(), allowedCompliant, compliantBlocked,
                        safeAllowRate, thresholds.safeAllowRate(), safeAllowPass),
                new ReliabilityGateReport.Classification(results.size(), matches, results.size() - matches,
                        safeRate(matches, results.size())),
                new ReliabilityGateReport.Gates(failedMetrics.isEmpty(), failedMetrics));
    }

    static List<ReliabilityGateReport.ClassSummary> byFailureClass(List<ReliabilityGateReport.FixtureResult> results) {
        return Arrays.stream(FailureClass.values()).map(failureClass -> {
            List<ReliabilityGateReport.FixtureResult> bucket = results.stream()
                    .filter(r -> r.failureClass() == failureClass).toList();
            int recoverable = (int) bucket.stream()
                    .filter(r -> r.recoverability() == Recoverability.RECOVERABLE).count();
            int nonRecoverable = bucket.size() - recoverable;
            int recovered = count(bucket, c -> c.recovered());
            int blockedUnsafe = count(bucket, c -> c.blockedUnsafeContinuation());
            int allowedCompliant = count(bucket, c -> c.allowedCompliantContinuation());
            return new ReliabilityGateReport.ClassSummary(
                    failureClass,
                    bucket.size(),
                    recoverable,
                    nonRecoverable,
                    recovered,
                    blockedUnsafe,
                    count(bucket, c -> c.unsafeContinuationAllowed()),
                    allowedCompliant,
                    count(bucket, c -> c.compliantContinuationBlocked()),
                    safeRate(recovered, recoverable),
                    safeRate(blockedUnsafe, nonRecoverable),
                    safeRate(allowedCompliant, recoverable));
        }).toList();
    }

    static double safeRate(int numerator, int denominator) {
        return denominator == 0 ? 0 : (double) numerator / denominator;
    }

    private static int count(List<ReliabilityGateReport.FixtureResult> results,
                             Predicate<ReliabilityGateReport.Checks> check) {
        return (int) results.stream().map(ReliabilityGateReport.FixtureResult::checks).filter(check).count();
    }
}
