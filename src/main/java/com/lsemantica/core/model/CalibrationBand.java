package com.lsemantica.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CalibrationBand implements WireValue {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireValue;

    CalibrationBand(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static CalibrationBand fromWire(String value) {
        return WireValue.parse(CalibrationBand.class, value, "calibration_band");
    }
}
