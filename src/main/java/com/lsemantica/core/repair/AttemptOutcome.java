package com.lsemantica.core.repair;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Outcome of a single rule application. */
public enum AttemptOutcome implements WireValue {
    REPAIRED("repaired"),
    RETRY("retry"),
    ESCALATE("escalate"),
    STOP("stop");

    private final String wireValue;

    AttemptOutcome(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Terminal decision for this outcome.
     *
     * @throws IllegalStateException for {@link #RETRY}, which is not terminal
     */
    public RepairDecision toDecision() {
        return switch (this) {
            case REPAIRED -> RepairDecision.REPAIRED;
            case ESCALATE -> RepairDecision.ESCALATE;
            case STOP -> RepairDecision.STOP;
            case RETRY -> throw new IllegalStateException("retry is not a terminal repair decision");
        };
    }

    @JsonCreator
    public static AttemptOutcome fromWire(String value) {
        return WireValue.parse(AttemptOutcome.class, value, "outcome");
    }
}
