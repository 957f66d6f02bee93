package com.lsemantica.core.reliability;

import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.repair.RepairArtifact;
import com.lsemantica.core.repair.RepairRequest;
import com.lsemantica.core.repair.RepairStage;

import java.util.List;

/**
 * Validated failure fixture corpus. Every string field is already trimmed; fixture ids are
 * unique and each fixture's expectation agrees with its recoverability.
 */
public record ReliabilityCorpus(
        String schemaVersion,
        String corpusId,
        String description,
        List<Fixture> fixtures
) {

    public static final String SCHEMA_VERSION = "0.1.0";

    public ReliabilityCorpus {
        fixtures = List.copyOf(fixtures);
    }

    public record Fixture(
            String id,
            FailureClass failureClass,
            String scenario,
            Recoverability recoverability,
            Expected expected,
            Input input
    ) {

        public boolean recoverable() {
            return recoverability == Recoverability.RECOVERABLE;
        }

        public RepairRequest toRepairRequest() {
            return new RepairRequest(failureClass, input.stage(), input.artifact(), input.excerpt());
        }
    }

    /**
     * @param expectedConfidence optional confidence window, {@code null} when the fixture does not declare one
     */
    public record Expected(
            FailureClass classification,
            boolean continuationAllowed,
            ExpectedConfidence expectedConfidence
    ) {}

    public record ExpectedConfidence(double scoreMin, double scoreMax, CalibrationBand calibrationBand) {}

    public record Input(RepairStage stage, RepairArtifact artifact, String excerpt) {}
}
