package com.lsemantica.core.trace;

/**
 * Error captured from a governed invocation. Blank exception names normalize to {@code Error}.
 */
public record TraceError(String name, String message) {

    public static TraceError of(Throwable error) {
        if (error == null) {
            return new TraceError("NonErrorThrown", "[unstringifiable thrown value]");
        }
        String name = HookResolver.trimToNull(error.getClass().getSimpleName());
        String message = error.getMessage() == null ? "" : error.getMessage();
        return new TraceError(name == null ? "Error" : name, message);
    }
}
