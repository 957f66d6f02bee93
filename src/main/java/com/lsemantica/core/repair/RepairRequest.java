package com.lsemantica.core.repair;

import com.lsemantica.core.model.FailureClass;

/**
 * Classified failure handed to the repair loop. The excerpt keeps its original whitespace.
 */
public record RepairRequest(FailureClass failureClass, RepairStage stage, RepairArtifact artifact, String excerpt) {

    public RepairRequest {
        if (failureClass == null || stage == null || artifact == null) {
            throw new RepairInputException(RepairInputException.Code.INVALID_INPUT,
                    "failureClass, stage and artifact are required");
        }
        if (excerpt == null || excerpt.trim().isEmpty()) {
            throw new RepairInputException(RepairInputException.Code.INVALID_INPUT,
                    "excerpt must be a non-empty string");
        }
    }

    /**
     * Builds a request from wire literals, as read from the CLI or a corpus fixture.
     *
     * @throws RepairInputException when any literal is blank or unknown
     */
    public static RepairRequest parse(String failureClass, String stage, String artifact, String excerpt) {
        try {
            return new RepairRequest(
                    FailureClass.fromWire(failureClass),
                    RepairStage.fromWire(stage),
                    RepairArtifact.fromWire(artifact),
                    excerpt);
        } catch (IllegalArgumentException e) {
            throw new RepairInputException(RepairInputException.Code.INVALID_INPUT, e.getMessage(), e);
        }
    }

    /** Target label used by FeedbackTensor repair actions, e.g. {@code compile.ls_source}. */
    public String target() {
        return stage.wireValue() + "." + artifact.wireValue();
    }
}
