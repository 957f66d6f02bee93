package com.lsemantica.core.repair;

import com.lsemantica.core.model.FailureClass;

import java.util.List;

/**
 * Terminal result of one repair loop run.
 *
 * @param appliedRuleId   rule that produced the terminal outcome, {@code null} when none matched
 * @param repairedExcerpt present only for {@link RepairDecision#REPAIRED}
 */
public record RepairResult(
        FailureClass classification,
        RepairDecision decision,
        boolean continuationAllowed,
        String reasonCode,
        String detail,
        int attempts,
        int maxAttempts,
        String appliedRuleId,
        String repairedExcerpt,
        List<RepairAttempt> history
) {

    public RepairResult {
        history = List.copyOf(history);
    }
}
