package com.lsemantica.core.repair;

/**
 * Result of applying one rule.
 *
 * @param nextExcerpt optional replacement excerpt for the next attempt after a retry
 */
public record RuleOutcome(AttemptOutcome type, String reasonCode, String detail, String repairedExcerpt,
                          String nextExcerpt) {

    public static RuleOutcome repaired(String reasonCode, String detail, String repairedExcerpt) {
        return new RuleOutcome(AttemptOutcome.REPAIRED, reasonCode, detail, repairedExcerpt, null);
    }

    public static RuleOutcome retry(String reasonCode, String detail) {
        return new RuleOutcome(AttemptOutcome.RETRY, reasonCode, detail, null, null);
    }

    public static RuleOutcome escalate(String reasonCode, String detail) {
        return new RuleOutcome(AttemptOutcome.ESCALATE, reasonCode, detail, null, null);
    }

    public static RuleOutcome stop(String reasonCode, String detail) {
        return new RuleOutcome(AttemptOutcome.STOP, reasonCode, detail, null, null);
    }
}
