package com.lsemantica.core.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Stage that observed the failure. */
public enum FailureStage implements WireValue {
    COMPILE("compile"),
    RUNTIME("runtime"),
    POLICY("policy"),
    CAPABILITY("capability"),
    REPAIR("repair");

    private final String wireValue;

    FailureStage(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static FailureStage fromWire(String value) {
        return WireValue.parse(FailureStage.class, value, "failure_signal.stage");
    }
}
