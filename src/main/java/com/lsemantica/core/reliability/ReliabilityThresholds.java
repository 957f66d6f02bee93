package com.lsemantica.core.reliability;

/** Minimum gate rates the corpus replay must reach, each within {@code [0, 1]}. */
public record ReliabilityThresholds(
        String schemaVersion,
        String thresholdId,
        String corpusSchemaVersion,
        Metrics metrics
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public record Metrics(double recoveryRate, double safeBlockRate, double safeAllowRate) {}
}
