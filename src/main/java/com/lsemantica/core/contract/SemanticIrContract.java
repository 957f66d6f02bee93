package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validated SemanticIR document.
 *
 * @param document deep copy of the validated JSON; callers must not mutate it
 */
public record SemanticIrContract(String schemaVersion, String irId, String goal, JsonNode document) {

    public int deterministicNodeCount() {
        return document.path("deterministic_nodes").size();
    }

    public int stochasticNodeCount() {
        return document.path("stochastic_nodes").size();
    }
}
