package com.lsemantica.core.pipeline.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

public enum CheckStatus implements WireValue {
    PASS("pass"),
    FAIL("fail"),
    NOT_RUN("not_run");

    private final String wireValue;

    CheckStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static CheckStatus fromWire(String value) {
        return WireValue.parse(CheckStatus.class, value, "verification_results.status");
    }
}
