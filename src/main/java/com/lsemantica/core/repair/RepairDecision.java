package com.lsemantica.core.repair;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Terminal decision of one repair loop run. */
public enum RepairDecision implements WireValue {
    REPAIRED("repaired"),
    ESCALATE("escalate"),
    STOP("stop");

    private final String wireValue;

    RepairDecision(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean allowsContinuation() {
        return this == REPAIRED;
    }

    @JsonCreator
    public static RepairDecision fromWire(String value) {
        return WireValue.parse(RepairDecision.class, value, "decision");
    }
}
