package com.lsemantica.core.runtime;

import com.lsemantica.core.gate.GateDecision;

/**
 * Raised by {@link SemanticIrRunner} when the continuation gate does not return
 * {@code continue}.
 */
public class RuntimeContinuationGateException extends RuntimeException {

    private final GateDecision decision;

    public RuntimeContinuationGateException(GateDecision decision) {
        super("Continuation gate returned " + decision.decision().wireValue() + " ("
                + decision.reasonCode() + "): " + decision.detail());
        this.decision = decision;
    }

    public GateDecision decision() {
        return decision;
    }
}
