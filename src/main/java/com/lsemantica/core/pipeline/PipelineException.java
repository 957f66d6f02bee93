package com.lsemantica.core.pipeline;

/**
 * Base class for input errors raised by pipeline stages. Decisions are never thrown; an
 * exception means the stage refused to produce an artifact at all.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Machine-readable error code, for example {@code INVALID_OPTIONS}. */
    public abstract String codeName();
}
