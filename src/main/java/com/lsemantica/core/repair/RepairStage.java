package com.lsemantica.core.repair;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Pipeline stage at which the failure was observed. */
public enum RepairStage implements WireValue {
    COMPILE("compile"),
    CONTRACT_LOAD("contract_load"),
    POLICY_GATE("policy_gate"),
    RUNTIME("runtime"),
    EXTRACTION("extraction");

    private final String wireValue;

    RepairStage(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RepairStage fromWire(String value) {
        return WireValue.parse(RepairStage.class, value, "stage");
    }
}
