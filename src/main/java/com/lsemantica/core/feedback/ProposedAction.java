package com.lsemantica.core.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.lsemantica.core.model.WireValue;

/** Next step recommended by a FeedbackTensor record. */
public enum ProposedAction implements WireValue {
    RETRY_WITH_PATCH("retry_with_patch"),
    ADJUST_PROMPT("adjust_prompt"),
    REQUEST_MANUAL_REVIEW("request_manual_review"),
    ABORT("abort");

    private final String wireValue;

    ProposedAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ProposedAction fromWire(String value) {
        return WireValue.parse(ProposedAction.class, value, "proposed_repair_action.action");
    }
}
