package com.lsemantica.core.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Component that produced a FeedbackTensor record. */
public enum SourceStage implements WireValue {
    RUNTIME("runtime"),
    REPAIR_LOOP("repair_loop"),
    POLICY_GATE("policy_gate");

    private final String wireValue;

    SourceStage(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SourceStage fromWire(String value) {
        return WireValue.parse(SourceStage.class, value, "provenance.source_stage");
    }
}
