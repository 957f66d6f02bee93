package com.lsemantica.dispatch.cli;

import com.lsemantica.core.contract.ContractLoader;
import com.lsemantica.core.gate.ContinuationGate;
import com.lsemantica.core.gate.GateDecision;
import com.lsemantica.core.gate.GateInput;
import com.lsemantica.core.gate.VerificationStatus;
import com.lsemantica.core.metrics.GovernanceMetrics;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica gate --contract &lt;verification-contract&gt; [--policy] [--status] [--feedback]
 * <p>
 * Evaluates the continuation gate and prints the decision.
 */
@Command(name = "gate", mixinStandardHelpOptions = true, description = "Evaluate the continuation gate")
@Component
public class GateCommand implements Callable<Integer> {

    @Option(names = "--contract", required = true, description = "VerificationContract JSON file")
    private Path contract;

    @Option(names = "--policy", description = "PolicyProfile JSON file")
    private Path policy;

    @Option(names = "--status", description = "Verification status JSON: {checks: [{id, kind, passed}], warning_count}")
    private Path status;

    @Option(names = "--feedback", description = "FeedbackTensor JSON evidence")
    private Path feedback;

    private final ContractLoader contractLoader;
    private final ContinuationGate gate;
    private final GovernanceMetrics metrics;

    public GateCommand(ContractLoader contractLoader, ContinuationGate gate, GovernanceMetrics metrics) {
        this.contractLoader = contractLoader;
        this.gate = gate;
        this.metrics = metrics;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            GateInput input = GateInput.of(contractLoader.loadVerificationContract(CommandSupport.readJson(contract)));
            if (policy != null) {
                input = input.withPolicyProfile(contractLoader.loadPolicyProfile(CommandSupport.readJson(policy)));
            }
            if (status != null) {
                input = input.withVerificationStatus(CommandSupport.readJson(status, VerificationStatus.class));
            }
            if (feedback != null) {
                input = input.withFeedbackTensor(CommandSupport.readJson(feedback));
            }

            GateDecision decision = gate.evaluate(input);
            metrics.recordGateDecision(decision);
            CommandSupport.emit(decision, null, "gate decision");
            return CommandSupport.exitCode(decision.decision());
        });
    }
}
