package com.lsemantica.core.repair;

public record RepairAttempt(int attempt, String ruleId, AttemptOutcome outcome, String reasonCode, String detail) {}
