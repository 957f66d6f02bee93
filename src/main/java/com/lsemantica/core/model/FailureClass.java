package com.lsemantica.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed failure taxonomy shared by the repair loop, FeedbackTensor records and the
 * reliability corpus.
 */
public enum FailureClass implements WireValue {
    PARSE("parse"),
    SCHEMA_CONTRACT("schema_contract"),
    POLICY_GATE("policy_gate"),
    CAPABILITY_DENIED("capability_denied"),
    DETERMINISTIC_RUNTIME("deterministic_runtime"),
    STOCHASTIC_EXTRACTION_UNCERTAINTY("stochastic_extraction_uncertainty");

    private final String wireValue;

    FailureClass(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static FailureClass fromWire(String value) {
        return WireValue.parse(FailureClass.class, value, "failureClass");
    }
}
