package com.lsemantica.core.repair;

/**
 * What a rule sees on one attempt: the original request, the current excerpt and the
 * 1-based attempt number.
 */
public record RuleContext(RepairRequest request, String excerpt, int attempt) {

    boolean at(RepairStage stage, RepairArtifact artifact) {
        return request.stage() == stage && request.artifact() == artifact;
    }

    boolean contains(String... fragments) {
        for (String fragment : fragments) {
            if (!excerpt.contains(fragment)) {
                return false;
            }
        }
        return true;
    }
}
