package com.lsemantica.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.contract.PolicyProfileContract;
import com.lsemantica.core.contract.VerificationContract;
import com.lsemantica.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fail-closed continuation gate.
 * <p>
 * Rules are checked in a fixed order and the first one that applies decides:
 * <ol>
 *   <li>a required policy profile is missing: {@code stop}</li>
 *   <li>required FeedbackTensor evidence is missing: {@code stop}</li>
 *   <li>an enforced policy assertion fails: {@code escalate}</li>
 *   <li>verification results are missing, incomplete, below the pass ratio or over the
 *       warning limit: the contract's {@code on_failure}</li>
 *   <li>otherwise the contract's {@code on_success}</li>
 * </ol>
 * The gate never throws on a failed evaluation; callers branch on the returned decision.
 */
@Service
public class ContinuationGate {

    private static final Logger log = LoggerFactory.getLogger(ContinuationGate.class);

    public GateDecision evaluate(GateInput input) {
        GateDecision decision = decide(input);
        log.info("Continuation gate {}: {} ({}/{} required checks, {} warning(s))",
                decision.decision().wireValue(), decision.reasonCode(),
                decision.requiredChecksPassed(), decision.requiredChecksTotal(), decision.warningCount());
        return decision;
    }

    /** Decision used when a runtime invocation has no verification contract. */
    public GateDecision bypass() {
        return new GateDecision(Decision.CONTINUE, true, GateReasonCode.CONTINUATION_GATE_NOT_CONFIGURED,
                "Continuation gate was not configured for this runtime invocation.",
                0, 0, 1, 0, 0, List.of(), List.of());
    }

    private GateDecision decide(GateInput input) {
        if (input == null || input.verificationContract() == null) {
            throw new IllegalArgumentException("Continuation gate requires a verification contract");
        }
        VerificationContract contract = input.verificationContract();
        PolicyProfileContract profile = input.policyProfile();
        VerificationStatus status = input.verificationStatus();
        int maxWarnings = contract.passCriteria().maxWarningCount();

        List<RequiredCheck> requiredChecks = requiredChecks(contract);
        List<VerificationContract.PolicyAssertion> requiredAssertions = contract.policyAssertions().stream()
                .filter(VerificationContract.PolicyAssertion::required)
                .toList();
        List<VerificationContract.PolicyAssertion> enforced = contract.passCriteria().requireAllPolicyAssertions()
                ? contract.policyAssertions()
                : requiredAssertions;
        int total = requiredChecks.size() + requiredAssertions.size();
        int warnings = status == null ? 0 : status.warningCount();

        if (profile == null && (contract.continuation().requirePolicyProfile() || !enforced.isEmpty())) {
            return decision(Decision.STOP, GateReasonCode.POLICY_PROFILE_REQUIRED,
                    "Verification continuation policy requires a validated PolicyProfile contract.",
                    0, total, 0, maxWarnings, List.of(), List.of());
        }

        List<String> missingFields = missingFeedbackFields(contract.continuation().requiredFeedbackTensorFields(),
                input.feedbackTensor());
        if (!missingFields.isEmpty()) {
            return decision(Decision.STOP, GateReasonCode.VERIFICATION_REQUIRED_FEEDBACK_MISSING,
                    "Verification evidence is missing required FeedbackTensor fields" + suffix(missingFields) + ".",
                    0, total, warnings, maxWarnings, missingFields, List.of());
        }

        Coverage coverage = coverage(requiredChecks, status);
        List<String> failedAssertions = new ArrayList<>();
        int passedRequiredAssertions = 0;
        for (VerificationContract.PolicyAssertion assertion : enforced) {
            boolean passed = assertionHolds(profile, assertion);
            if (!passed) {
                failedAssertions.add(assertion.id());
            } else if (assertion.required()) {
                passedRequiredAssertions++;
            }
        }
        int passed = coverage.passed() + passedRequiredAssertions;

        if (!failedAssertions.isEmpty()) {
            return decision(Decision.ESCALATE, GateReasonCode.VERIFICATION_POLICY_ASSERTION_FAILED,
                    "Policy assertion verification failed" + suffix(failedAssertions) + ".",
                    passed, total, warnings, maxWarnings, List.of(), failedAssertions);
        }

        Decision onFailure = contract.continuation().onFailure();
        if (status == null) {
            return decision(onFailure, GateReasonCode.VERIFICATION_REQUIRED_CHECKS_BELOW_THRESHOLD,
                    "Verification status summary is required to evaluate continuation.",
                    0, total, 0, maxWarnings, List.of(), List.of());
        }
        if (!coverage.missingKeys().isEmpty()) {
            return decision(onFailure, GateReasonCode.VERIFICATION_REQUIRED_CHECKS_BELOW_THRESHOLD,
                    "Verification status is missing required check results" + suffix(coverage.missingKeys()) + ".",
                    passed, total, warnings, maxWarnings, List.of(), List.of());
        }

        double ratio = ratio(passed, total);
        double minimum = contract.passCriteria().minimumRequiredChecksPassRatio();
        if (ratio < minimum) {
            return decision(onFailure, GateReasonCode.VERIFICATION_REQUIRED_CHECKS_BELOW_THRESHOLD,
                    String.format(Locale.ROOT, "Required verification pass ratio %.2f is below minimum %.2f.",
                            ratio, minimum),
                    passed, total, warnings, maxWarnings, List.of(), List.of());
        }
        if (warnings > maxWarnings) {
            return decision(onFailure, GateReasonCode.VERIFICATION_REQUIRED_CHECKS_BELOW_THRESHOLD,
                    "Verification warnings " + warnings + " exceed max allowed " + maxWarnings + ".",
                    passed, total, warnings, maxWarnings, List.of(), List.of());
        }

        return decision(contract.continuation().onSuccess(), GateReasonCode.VERIFICATION_GATE_PASSED,
                "Verification and policy checks passed; autonomous continuation is allowed.",
                passed, total, warnings, maxWarnings, List.of(), List.of());
    }

    private static GateDecision decision(Decision decision, GateReasonCode reasonCode, String detail, int passed,
                                         int total, int warnings, int maxWarnings, List<String> missingFields,
                                         List<String> failedAssertions) {
        return new GateDecision(decision, decision.allowsContinuation(), reasonCode, detail, passed, total,
                ratio(passed, total), warnings, maxWarnings, missingFields, failedAssertions);
    }

    private static double ratio(int passed, int total) {
        return total == 0 ? 1 : (double) passed / total;
    }

    private static String suffix(List<String> items) {
        return items.isEmpty() ? "" : " (" + String.join(", ", items) + ")";
    }

    static List<String> missingFeedbackFields(List<String> requiredFields, JsonNode evidence) {
        if (evidence == null || !evidence.isObject()) {
            return List.copyOf(requiredFields);
        }
        return requiredFields.stream()
                .filter(field -> {
                    JsonNode value = evidence.get(field);
                    return value == null || value.isNull() || value.isMissingNode();
                })
                .toList();
    }

    private static boolean assertionHolds(PolicyProfileContract profile, VerificationContract.PolicyAssertion assertion) {
        Optional<JsonNode> actual = profile.resolvePath(assertion.policyPath());
        return actual.isPresent() && assertion.expected() != null && jsonEquals(actual.get(), assertion.expected());
    }

    // Numeric nodes compare by value so 3 and 3.0 are equal.
    private static boolean jsonEquals(JsonNode actual, JsonNode expected) {
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        return actual.equals(expected);
    }

    private static List<RequiredCheck> requiredChecks(VerificationContract contract) {
        List<RequiredCheck> checks = new ArrayList<>();
        contract.tests().stream().filter(VerificationContract.CheckRequirement::required)
                .forEach(check -> checks.add(new RequiredCheck(CheckKind.TEST, check.id())));
        contract.staticAnalysis().stream().filter(VerificationContract.CheckRequirement::required)
                .forEach(check -> checks.add(new RequiredCheck(CheckKind.STATIC_ANALYSIS, check.id())));
        return checks;
    }

    private static Coverage coverage(List<RequiredCheck> requiredChecks, VerificationStatus status) {
        if (status == null) {
            return new Coverage(0, List.of());
        }
        Map<String, VerificationStatus.CheckResult> byKey = new HashMap<>();
        for (VerificationStatus.CheckResult result : status.checks()) {
            byKey.put(result.key(), result);
        }
        int passed = 0;
        List<String> missing = new ArrayList<>();
        for (RequiredCheck check : requiredChecks) {
            VerificationStatus.CheckResult result = byKey.get(check.key());
            if (result == null) {
                missing.add(check.key());
            } else if (result.passed()) {
                passed++;
            }
        }
        return new Coverage(passed, missing);
    }

    private record RequiredCheck(CheckKind kind, String id) {
        String key() {
            return kind.wireValue() + ":" + id;
        }
    }

    private record Coverage(int passed, List<String> missingKeys) {}
}
