package com.lsemantica.core.pipeline.diffplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

public enum EditOperation implements WireValue {
    CREATE("create"),
    MODIFY("modify"),
    DELETE("delete");

    private final String wireValue;

    EditOperation(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Operation that undoes this one in a reverse patch. */
    public EditOperation inverse() {
        return switch (this) {
            case CREATE -> DELETE;
            case DELETE -> CREATE;
            case MODIFY -> MODIFY;
        };
    }

    @JsonCreator
    public static EditOperation fromWire(String value) {
        return WireValue.parse(EditOperation.class, value, "operation");
    }
}
