package com.lsemantica.core.metrics;

import com.lsemantica.core.gate.GateDecision;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.repair.RepairResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for repair, gate, pipeline and reliability decisions.
 */
@Service
public class GovernanceMetrics {

    private final MeterRegistry registry;

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRepairOutcome(RepairResult result) {
        Counter.builder("lsemantica.repair.outcomes")
                .tag("decision", result.decision().wireValue())
                .tag("reason", result.reasonCode())
                .register(registry)
                .increment();

        DistributionSummary.builder("lsemantica.repair.attempts")
                .description("Attempts consumed per repair loop run")
                .register(registry)
                .record(result.attempts());
    }

    public void recordGateDecision(GateDecision decision) {
        Counter.builder("lsemantica.gate.decisions")
                .tag("decision", decision.decision().wireValue())
                .tag("reason", decision.reasonCode().name())
                .register(registry)
                .increment();
    }

    /**
     * Records one pipeline stage run.
     *
     * @param decision the artifact's decision, {@code null} for stages that carry none (the snapshot)
     */
    public void recordPipelineStage(ArtifactType stage, Decision decision, long ms) {
        Counter.builder("lsemantica.pipeline.stage.decisions")
                .tag("stage", stage.typeId())
                .tag("decision", decision == null ? "none" : decision.wireValue())
                .register(registry)
                .increment();

        Timer.builder("lsemantica.pipeline.stage.duration")
                .tag("stage", stage.typeId())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReliabilityGateRun(boolean pass) {
        Counter.builder("lsemantica.reliability.gate.runs")
                .tag("result", pass ? "pass" : "fail")
                .register(registry)
                .increment();
    }
}
