package com.lsemantica.core.pipeline.diffplan;

import com.lsemantica.core.pipeline.PipelineException;

public class SafeDiffPlanException extends PipelineException {

    public enum Code {
        INVALID_INTENT_MAPPING,
        INVALID_OPTIONS
    }

    private final Code code;

    public SafeDiffPlanException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public Code code() {
        return code;
    }

    @Override
    public String codeName() {
        return code.name();
    }
}
