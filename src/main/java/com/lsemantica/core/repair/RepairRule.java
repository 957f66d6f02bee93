package com.lsemantica.core.repair;

import com.lsemantica.core.model.FailureClass;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered repair table: a precondition and the action it unlocks.
 */
public record RepairRule(String id, FailureClass failureClass, Predicate<RuleContext> matches,
                         Function<RuleContext, RuleOutcome> apply) {}
