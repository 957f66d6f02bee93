package com.lsemantica.core.runtime;

import com.lsemantica.core.gate.GateDecision;

public record RuntimeResult(boolean ok, String traceId, GateDecision continuationDecision) {}
