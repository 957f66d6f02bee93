package com.lsemantica.core.pipeline.intent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

public enum ExtractionMethod implements WireValue {
    AST_SYMBOL_LOOKUP("ast_symbol_lookup"),
    TEXT_MATCH("text_match");

    private final String wireValue;

    ExtractionMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ExtractionMethod fromWire(String value) {
        return WireValue.parse(ExtractionMethod.class, value, "provenance.method");
    }
}
