package com.lsemantica.core.reliability;

/**
 * Raised when the reliability corpus or its gate thresholds cannot be read, fail validation or
 * do not fit together.
 */
public class ReliabilityCorpusException extends RuntimeException {

    public enum Code {
        UNREADABLE,
        INVALID_JSON,
        INVALID_CORPUS,
        INVALID_THRESHOLDS,
        THRESHOLD_VERSION_MISMATCH,
        MISSING_COVERAGE
    }

    private final Code code;

    public ReliabilityCorpusException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public ReliabilityCorpusException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }
}
