package com.lsemantica.core.reliability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Whether a corpus fixture describes a failure the repair loop is expected to recover from. */
public enum Recoverability implements WireValue {
    RECOVERABLE("recoverable"),
    NON_RECOVERABLE("non_recoverable");

    private final String wireValue;

    Recoverability(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static Recoverability fromWire(String value) {
        return WireValue.parse(Recoverability.class, value, "recoverability");
    }
}
