package com.lsemantica.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing governance MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void setArtifact(String runId, String stage, String artifactId) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
        MDC.put("artifactId", artifactId);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
        MDC.remove("artifactId");
    }
}
