package com.lsemantica.core.pipeline.intent;

import com.lsemantica.core.pipeline.PipelineException;

public class IntentMappingException extends PipelineException {

    public enum Code {
        INVALID_INTENT,
        INVALID_INTENT_SOURCE,
        INVALID_WORKSPACE_SNAPSHOT,
        INVALID_OPTIONS,
        WORKSPACE_ROOT_UNREADABLE,
        WORKSPACE_ROOT_NOT_DIRECTORY,
        WORKSPACE_ENTRY_UNREADABLE
    }

    private final Code code;

    public IntentMappingException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public IntentMappingException(Code code, String message, Throwable cause) {
        super(message, cause);
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
