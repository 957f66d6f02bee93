package com.lsemantica.core.gate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

public enum CheckKind implements WireValue {
    TEST("test"),
    STATIC_ANALYSIS("static_analysis");

    private final String wireValue;

    CheckKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static CheckKind fromWire(String value) {
        return WireValue.parse(CheckKind.class, value, "kind");
    }
}
