package com.lsemantica.core.pipeline.bundle;

import com.lsemantica.core.pipeline.PipelineException;

public class PrBundleException extends PipelineException {

    public enum Code {
        INVALID_PATCH_RUN,
        INVALID_LINEAGE,
        INVALID_OPTIONS
    }

    private final Code code;

    public PrBundleException(Code code, String message) {
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
