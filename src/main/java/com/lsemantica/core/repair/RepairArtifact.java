package com.lsemantica.core.repair;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Kind of artifact the failing excerpt was taken from. */
public enum RepairArtifact implements WireValue {
    LS_SOURCE("ls_source"),
    SEMANTIC_IR("semantic_ir"),
    POLICY_PROFILE("policy_profile"),
    CAPABILITY_MANIFEST("capability_manifest"),
    RUNTIME_EVENT("runtime_event"),
    MODEL_OUTPUT("model_output");

    private final String wireValue;

    RepairArtifact(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RepairArtifact fromWire(String value) {
        return WireValue.parse(RepairArtifact.class, value, "artifact");
    }
}
