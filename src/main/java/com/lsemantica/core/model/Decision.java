package com.lsemantica.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shared continuation decision used by the continuation gate and every decision-making
 * pipeline stage.
 */
public enum Decision implements WireValue {
    CONTINUE("continue"),
    ESCALATE("escalate"),
    STOP("stop");

    private final String wireValue;

    Decision(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean allowsContinuation() {
        return this == CONTINUE;
    }

    @JsonCreator
    public static Decision fromWire(String value) {
        return WireValue.parse(Decision.class, value, "decision");
    }
}
