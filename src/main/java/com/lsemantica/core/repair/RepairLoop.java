package com.lsemantica.core.repair;

import com.lsemantica.core.trace.HookResolver;
import com.lsemantica.core.trace.NdjsonSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-first repair loop.
 * <p>
 * Rules registered for the request's failure class are tried in table order on every
 * attempt, and the first match decides that attempt. A {@code retry} outcome consumes one
 * attempt; any other outcome ends the run. When nothing matches the loop escalates rather
 * than guessing.
 */
@Service
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 2;
    public static final int ABSOLUTE_MAX_ATTEMPTS = 10;

    private final RepairTraceEmitter emitter;

    public RepairLoop(NdjsonSink sink) {
        this.emitter = new RepairTraceEmitter(sink);
    }

    public RepairResult run(RepairRequest request) {
        return run(request, RepairOptions.defaults());
    }

    public RepairResult run(RepairRequest request, RepairOptions options) {
        if (request == null) {
            throw new RepairInputException(RepairInputException.Code.INVALID_INPUT,
                    "repair loop input must be an object");
        }
        RepairOptions effective = options != null ? options : RepairOptions.defaults();
        int maxAttempts = validateMaxAttempts(effective.maxAttempts());

        String runId = null;
        String startedAt = null;
        if (effective.emitsAnything()) {
            runId = HookResolver.resolveRunId(effective.runId(), effective.hooksOrDefaults().runIdFactory(), null);
        }
        if (effective.emitsInspection()) {
            startedAt = HookResolver.resolveTimestamp(effective.hooksOrDefaults().clock());
        }

        RepairResult result = decide(request, maxAttempts);
        log.info("Repair {} for {} at {}: {} ({}) after {}/{} attempt(s)",
                result.decision().wireValue(), request.failureClass().wireValue(), request.target(),
                result.reasonCode(), result.appliedRuleId() == null ? "no rule" : result.appliedRuleId(),
                result.attempts(), result.maxAttempts());

        if (effective.emitsAnything()) {
            emitter.emit(request, result, effective, runId, startedAt);
        }
        return result;
    }

    static int validateMaxAttempts(Integer maxAttempts) {
        if (maxAttempts == null) {
            return DEFAULT_MAX_ATTEMPTS;
        }
        if (maxAttempts < 1) {
            throw new RepairInputException(RepairInputException.Code.INVALID_MAX_ATTEMPTS,
                    "maxAttempts must be an integer greater than or equal to 1");
        }
        if (maxAttempts > ABSOLUTE_MAX_ATTEMPTS) {
            throw new RepairInputException(RepairInputException.Code.INVALID_MAX_ATTEMPTS,
                    "maxAttempts must be less than or equal to " + ABSOLUTE_MAX_ATTEMPTS);
        }
        return maxAttempts;
    }

    private RepairResult decide(RepairRequest request, int maxAttempts) {
        List<RepairRule> rules = RepairRules.forClass(request.failureClass());
        List<RepairAttempt> history = new ArrayList<>();

        if (rules.isEmpty()) {
            return terminal(request, maxAttempts, RepairDecision.ESCALATE, "NO_RULES_REGISTERED",
                    "No deterministic repair rules are registered for failure class \""
                            + request.failureClass().wireValue() + "\".",
                    0, history, null, null);
        }

        String excerpt = request.excerpt();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            RuleContext context = new RuleContext(request, excerpt, attempt);
            RepairRule rule = rules.stream().filter(r -> r.matches().test(context)).findFirst().orElse(null);
            if (rule == null) {
                return terminal(request, maxAttempts, RepairDecision.ESCALATE, "NO_SAFE_DETERMINISTIC_REPAIR",
                        "No deterministic repair rule matched this failure payload safely.",
                        attempt, history, null, null);
            }

            RuleOutcome outcome = rule.apply().apply(context);
            log.debug("Attempt {}: rule {} -> {} ({})", attempt, rule.id(), outcome.type().wireValue(),
                    outcome.reasonCode());
            history.add(new RepairAttempt(attempt, rule.id(), outcome.type(), outcome.reasonCode(), outcome.detail()));

            switch (outcome.type()) {
                case RETRY -> {
                    if (outcome.nextExcerpt() != null) {
                        excerpt = outcome.nextExcerpt();
                    }
                    if (attempt == maxAttempts) {
                        return terminal(request, maxAttempts, RepairDecision.STOP, "MAX_ATTEMPTS_EXCEEDED",
                                "Maximum retry attempts reached (" + maxAttempts + ") after "
                                        + outcome.reasonCode() + ".",
                                attempt, history, rule.id(), null);
                    }
                }
                case REPAIRED -> {
                    return terminal(request, maxAttempts, RepairDecision.REPAIRED, outcome.reasonCode(),
                            outcome.detail(), attempt, history, rule.id(),
                            outcome.repairedExcerpt() != null ? outcome.repairedExcerpt() : excerpt);
                }
                case ESCALATE, STOP -> {
                    return terminal(request, maxAttempts, outcome.type().toDecision(), outcome.reasonCode(),
                            outcome.detail(), attempt, history, rule.id(), null);
                }
            }
        }

        return terminal(request, maxAttempts, RepairDecision.STOP, "MAX_ATTEMPTS_EXCEEDED",
                "Maximum retry attempts reached (" + maxAttempts + ").", maxAttempts, history, null, null);
    }

    private static RepairResult terminal(RepairRequest request, int maxAttempts, RepairDecision decision,
                                         String reasonCode, String detail, int attempts, List<RepairAttempt> history,
                                         String appliedRuleId, String repairedExcerpt) {
        return new RepairResult(request.failureClass(), decision, decision.allowsContinuation(), reasonCode, detail,
                attempts, maxAttempts, appliedRuleId, repairedExcerpt, history);
    }
}
