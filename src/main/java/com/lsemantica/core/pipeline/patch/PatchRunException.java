package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.pipeline.PipelineException;

public class PatchRunException extends PipelineException {

    public enum Code {
        INVALID_SAFE_DIFF_PLAN,
        INVALID_OPTIONS
    }

    private final Code code;

    public PatchRunException(Code code, String message) {
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
