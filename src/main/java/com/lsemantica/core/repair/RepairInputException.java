package com.lsemantica.core.repair;

/**
 * Rejected repair loop input. Raised before any rule runs.
 */
public class RepairInputException extends RuntimeException {

    public enum Code {
        INVALID_INPUT,
        INVALID_MAX_ATTEMPTS
    }

    private final Code code;

    public RepairInputException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public RepairInputException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code code() {
        return code;
    }
}
