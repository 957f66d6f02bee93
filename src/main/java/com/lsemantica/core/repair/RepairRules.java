package com.lsemantica.core.repair;

import com.lsemantica.core.contract.ContractName;
import com.lsemantica.core.model.FailureClass;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The ordered repair rule table. Parse rules come first, then schema contract, policy gate,
 * capability, deterministic runtime and stochastic extraction rules; within a failure class
 * the first matching rule wins.
 */
public final class RepairRules {

    private static final String GOAL_PREFIX = "goal \"";

    private static final Pattern SCHEMA_VERSION = Pattern.compile("\"schema_version\"\\s*:\\s*\"([^\"]*)\"");
    private static final String NUMBER = "([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)";
    private static final Pattern CONFIDENCE = Pattern.compile("confidence=" + NUMBER);
    private static final Pattern CONFIDENCE_THRESHOLD_PAIR = Pattern.compile(
            "confidence=" + NUMBER + "\\s*;\\s*threshold=" + NUMBER
                    + "|threshold=" + NUMBER + "\\s*;\\s*confidence=" + NUMBER);
    private static final Pattern FALLBACK_PLAN =
            Pattern.compile("fallback_plan=([a-z0-9_]+)(?=;|\\s|$)", Pattern.CASE_INSENSITIVE);

    private static final List<RepairRule> RULES = List.of(
            new RepairRule("parse.append_missing_goal_quote", FailureClass.PARSE,
                    ctx -> ctx.at(RepairStage.COMPILE, RepairArtifact.LS_SOURCE)
                            && ctx.excerpt().startsWith(GOAL_PREFIX)
                            && !ctx.excerpt().endsWith("\"")
                            && ctx.excerpt().length() > GOAL_PREFIX.length(),
                    ctx -> RuleOutcome.repaired("PARSE_APPEND_MISSING_QUOTE",
                            "Appended missing closing quote in goal declaration.",
                            ctx.excerpt() + "\"")),

            new RepairRule("parse.truncated_context", FailureClass.PARSE,
                    ctx -> ctx.at(RepairStage.COMPILE, RepairArtifact.LS_SOURCE)
                            && ctx.excerpt().equals(GOAL_PREFIX),
                    ctx -> RuleOutcome.escalate("PARSE_TRUNCATED_CONTEXT",
                            "Source is truncated and cannot be deterministically repaired.")),

            new RepairRule("schema_contract.normalize_schema_version_whitespace", FailureClass.SCHEMA_CONTRACT,
                    ctx -> schemaVersionOf(ctx)
                            .filter(raw -> !raw.trim().equals(raw))
                            .map(raw -> raw.trim().equals(expectedVersion(ctx.request().artifact())))
                            .orElse(false),
                    ctx -> {
                        String normalized = schemaVersionOf(ctx).map(String::trim).orElse("");
                        return RuleOutcome.repaired("SCHEMA_VERSION_WHITESPACE_NORMALIZED",
                                "Normalized schema_version whitespace to expected canonical version.",
                                SCHEMA_VERSION.matcher(ctx.excerpt()).replaceFirst(
                                        Matcher.quoteReplacement("\"schema_version\": \"" + normalized + "\"")));
                    }),

            new RepairRule("schema_contract.reject_incompatible_schema_version", FailureClass.SCHEMA_CONTRACT,
                    ctx -> schemaVersionOf(ctx)
                            .map(raw -> !raw.trim().equals(expectedVersion(ctx.request().artifact())))
                            .orElse(false),
                    ctx -> RuleOutcome.escalate("SCHEMA_VERSION_INCOMPATIBLE",
                            "Schema version is incompatible with supported runtime contracts.")),

            new RepairRule("policy_gate.apply_budget_fallback_plan", FailureClass.POLICY_GATE,
                    ctx -> ctx.at(RepairStage.POLICY_GATE, RepairArtifact.POLICY_PROFILE)
                            && ctx.contains("max_tokens exceeded", "fallback_plan="),
                    ctx -> {
                        Matcher matcher = FALLBACK_PLAN.matcher(ctx.excerpt());
                        if (!matcher.find()) {
                            return RuleOutcome.escalate("POLICY_FALLBACK_PLAN_UNPARSEABLE",
                                    "Policy fallback plan could not be deterministically identified.");
                        }
                        String plan = matcher.group(1);
                        return RuleOutcome.repaired("POLICY_FALLBACK_PLAN_APPLIED",
                                "Applied deterministic policy fallback \"" + plan + "\".",
                                ctx.excerpt() + "; selected_fallback=" + plan);
                    }),

            new RepairRule("policy_gate.terminal_deny_production_destructive_write", FailureClass.POLICY_GATE,
                    ctx -> ctx.at(RepairStage.POLICY_GATE, RepairArtifact.POLICY_PROFILE)
                            && ctx.contains("action=delete_resource", "environment=production", "rule=deny"),
                    ctx -> RuleOutcome.stop("POLICY_DENY_TERMINAL",
                            "Production policy denies destructive action with no safe autonomous continuation.")),

            new RepairRule("capability_denied.downgrade_to_readonly_flow", FailureClass.CAPABILITY_DENIED,
                    ctx -> ctx.at(RepairStage.RUNTIME, RepairArtifact.CAPABILITY_MANIFEST)
                            && ctx.contains("requested=filesystem.write", "available=filesystem.read"),
                    ctx -> RuleOutcome.repaired("CAPABILITY_DOWNGRADED_TO_READONLY",
                            "Switched from write operation to read-only inspection fallback.",
                            replaceFirstLiteral(ctx.excerpt(), "requested=filesystem.write",
                                    "requested=filesystem.read"))),

            new RepairRule("capability_denied.required_network_capability_missing", FailureClass.CAPABILITY_DENIED,
                    ctx -> ctx.at(RepairStage.RUNTIME, RepairArtifact.CAPABILITY_MANIFEST)
                            && ctx.contains("requested=network.http", "available=[]"),
                    ctx -> RuleOutcome.escalate("CAPABILITY_NETWORK_REQUIRED",
                            "Required network capability is unavailable and no deterministic offline fallback exists.")),

            new RepairRule("deterministic_runtime.retry_timeout_then_recover", FailureClass.DETERMINISTIC_RUNTIME,
                    ctx -> ctx.at(RepairStage.RUNTIME, RepairArtifact.RUNTIME_EVENT)
                            && ctx.contains("error=timeout", "retryable=true"),
                    ctx -> {
                        if (ctx.attempt() < 2) {
                            return RuleOutcome.retry("DETERMINISTIC_TIMEOUT_RETRY",
                                    "Retryable deterministic timeout encountered; retrying with bounded attempt budget.");
                        }
                        String recovered = replaceFirstLiteral(ctx.excerpt(), "error=timeout", "error=none");
                        recovered = replaceFirstLiteral(recovered, "retryable=true", "retryable=false");
                        return RuleOutcome.repaired("DETERMINISTIC_TIMEOUT_RECOVERED",
                                "Deterministic timeout recovered within bounded retries.", recovered);
                    }),

            new RepairRule("deterministic_runtime.terminal_invariant_violation", FailureClass.DETERMINISTIC_RUNTIME,
                    ctx -> ctx.at(RepairStage.RUNTIME, RepairArtifact.RUNTIME_EVENT)
                            && ctx.contains("node_output missing for required dependency"),
                    ctx -> RuleOutcome.stop("DETERMINISTIC_INVARIANT_VIOLATION",
                            "Deterministic runtime invariant is violated; state cannot be safely continued.")),

            new RepairRule("stochastic_extraction_uncertainty.reprompt_to_raise_confidence",
                    FailureClass.STOCHASTIC_EXTRACTION_UNCERTAINTY,
                    ctx -> ctx.at(RepairStage.EXTRACTION, RepairArtifact.MODEL_OUTPUT)
                            && ConfidencePair.find(ctx.excerpt())
                                    .map(pair -> pair.confidence() < pair.threshold())
                                    .orElse(false),
                    ctx -> {
                        Optional<ConfidencePair> pair = ConfidencePair.find(ctx.excerpt());
                        if (pair.isEmpty()) {
                            return RuleOutcome.escalate("STOCHASTIC_CONFIDENCE_TUPLE_MISSING",
                                    "Confidence and threshold tuple could not be parsed for deterministic repair.");
                        }
                        if (ctx.attempt() < 2) {
                            return RuleOutcome.retry("STOCHASTIC_REPROMPT_REQUIRED",
                                    "Confidence below threshold; issuing constrained deterministic re-prompt.");
                        }
                        return RuleOutcome.repaired("STOCHASTIC_CONFIDENCE_RECOVERED",
                                "Confidence repaired to threshold using constrained deterministic re-prompting.",
                                pair.get().raiseConfidenceToThreshold(ctx.excerpt()));
                    }),

            new RepairRule("stochastic_extraction_uncertainty.ambiguous_entity_unresolved",
                    FailureClass.STOCHASTIC_EXTRACTION_UNCERTAINTY,
                    ctx -> ctx.at(RepairStage.EXTRACTION, RepairArtifact.MODEL_OUTPUT)
                            && ctx.contains("top_candidates overlap", "confidence delta < 0.02"),
                    ctx -> RuleOutcome.retry("STOCHASTIC_AMBIGUITY_RETRY",
                            "Entity ambiguity remains unresolved after constrained deterministic retry."))
    );

    private RepairRules() {}

    public static List<RepairRule> all() {
        return RULES;
    }

    public static List<RepairRule> forClass(FailureClass failureClass) {
        return RULES.stream().filter(rule -> rule.failureClass() == failureClass).toList();
    }

    public static List<String> order() {
        return RULES.stream().map(RepairRule::id).toList();
    }

    private static Optional<String> schemaVersionOf(RuleContext ctx) {
        if (ctx.request().stage() != RepairStage.CONTRACT_LOAD || expectedVersion(ctx.request().artifact()) == null) {
            return Optional.empty();
        }
        Matcher matcher = SCHEMA_VERSION.matcher(ctx.excerpt());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String expectedVersion(RepairArtifact artifact) {
        return switch (artifact) {
            case SEMANTIC_IR -> ContractName.SEMANTIC_IR.supportedVersion();
            case POLICY_PROFILE -> ContractName.POLICY_PROFILE.supportedVersion();
            default -> null;
        };
    }

    private static String replaceFirstLiteral(String text, String target, String replacement) {
        int index = text.indexOf(target);
        if (index < 0) {
            return text;
        }
        return text.substring(0, index) + replacement + text.substring(index + target.length());
    }

    /**
     * A {@code confidence=..; threshold=..} pair in either order. The literals are kept as
     * written so the repair copies the threshold text without reformatting it.
     */
    record ConfidencePair(double confidence, double threshold, String confidenceLiteral, String thresholdLiteral,
                          int start, int end) {

        static Optional<ConfidencePair> find(String excerpt) {
            Matcher matcher = CONFIDENCE_THRESHOLD_PAIR.matcher(excerpt);
            if (!matcher.find()) {
                return Optional.empty();
            }
            String confidenceLiteral = matcher.group(1) != null ? matcher.group(1) : matcher.group(4);
            String thresholdLiteral = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            if (confidenceLiteral == null || thresholdLiteral == null) {
                return Optional.empty();
            }
            double confidence = Double.parseDouble(confidenceLiteral);
            double threshold = Double.parseDouble(thresholdLiteral);
            if (!Double.isFinite(confidence) || !Double.isFinite(threshold)) {
                return Optional.empty();
            }
            return Optional.of(new ConfidencePair(confidence, threshold, confidenceLiteral, thresholdLiteral,
                    matcher.start(), matcher.end()));
        }

        String raiseConfidenceToThreshold(String excerpt) {
            String span = excerpt.substring(start, end);
            String repairedSpan = CONFIDENCE.matcher(span)
                    .replaceFirst(Matcher.quoteReplacement("confidence=" + thresholdLiteral));
            return excerpt.substring(0, start) + repairedSpan + excerpt.substring(end);
        }
    }
}
