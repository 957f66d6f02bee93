package com.lsemantica.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.contract.ContractLoader;
import com.lsemantica.core.contract.ContractName;
import com.lsemantica.core.contract.RuntimeContracts;
import com.lsemantica.core.gate.GateInput;
import com.lsemantica.core.gate.VerificationStatus;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.lsdoc.LsDiagnostic;
import com.lsemantica.core.lsdoc.LsDocument;
import com.lsemantica.core.lsdoc.LsDocumentReader;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.runtime.RuntimeContinuationGateException;
import com.lsemantica.core.runtime.RuntimeOptions;
import com.lsemantica.core.runtime.RuntimeResult;
import com.lsemantica.core.runtime.SemanticIrRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica run &lt;input&gt; [--contracts &lt;runtime-contracts&gt;]
 * <p>
 * Executes a SemanticIR input under the continuation gate. The input is either a SemanticIR
 * JSON object or an {@code .ls} document, whose goal becomes the runtime input.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute SemanticIR under the continuation gate")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "SemanticIR JSON or .ls document")
    private Path input;

    @Option(names = "--contracts", description = "Runtime contracts envelope {semanticIr, policyProfile, verificationContract?}")
    private Path contracts;

    @Option(names = "--status", description = "Verification status JSON for the gate")
    private Path status;

    @Option(names = "--feedback", description = "FeedbackTensor JSON evidence for the gate")
    private Path feedback;

    @Option(names = "--trace-ledger", description = "Append the trace ledger entry to this NDJSON file")
    private Path traceLedger;

    @Option(names = "--feedback-out", description = "Append FeedbackTensor records for failures to this NDJSON file")
    private Path feedbackOut;

    @Option(names = "--inspection-out", description = "Append the trace inspection entry to this NDJSON file")
    private Path inspectionOut;

    @Option(names = "--report-out", description = "Append the human-readable inspection report to this file")
    private Path reportOut;

    private final ContractLoader contractLoader;
    private final SemanticIrRunner runner;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public RunCommand(ContractLoader contractLoader, SemanticIrRunner runner, GovernanceMetrics metrics,
                      GovernanceProperties properties) {
        this.contractLoader = contractLoader;
        this.runner = runner;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            JsonNode ir = readRuntimeInput();
            GovernanceProperties.Trace trace = properties.getTrace();
            RuntimeOptions options = RuntimeOptions.defaults()
                    .withTraceLedgerPath(traceLedger != null ? traceLedger : trace.getLedgerPath())
                    .withFeedbackTensorPath(feedbackOut != null ? feedbackOut : trace.getFeedbackTensorPath())
                    .withTraceInspection(inspectionOut != null ? inspectionOut : trace.getInspectionPath(),
                            reportOut != null ? reportOut : trace.getInspectionReportPath());
            GateInput gateInput = gateInput();
            if (gateInput != null) {
                options = options.withContinuationGate(gateInput);
            }

            try {
                RuntimeResult result = runner.run(ir, options);
                metrics.recordGateDecision(result.continuationDecision());
                CommandSupport.emit(result, null, "runtime result");
                return CommandSupport.EXIT_OK;
            } catch (RuntimeContinuationGateException e) {
                metrics.recordGateDecision(e.decision());
                ConsoleOutput.error(e.getMessage());
                CommandSupport.emit(e.decision(), null, "gate decision");
                return CommandSupport.EXIT_BLOCKED;
            }
        });
    }

    private JsonNode readRuntimeInput() {
        if (!input.getFileName().toString().endsWith(".ls")) {
            return CommandSupport.readJson(input);
        }
        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + input, e);
        }
        LsDocumentReader.Result parsed = LsDocumentReader.read(source);
        LsDocument document = parsed.documentIfValid().orElse(null);
        if (document == null) {
            for (LsDiagnostic diagnostic : parsed.diagnostics()) {
                ConsoleOutput.issue(diagnostic.range().start().line() + ":" + diagnostic.range().start().column(),
                        diagnostic.message());
            }
            throw new IllegalArgumentException("Document failed to parse: " + input);
        }
        ObjectNode ir = CanonicalJson.mapper().createObjectNode();
        ir.put("version", ContractName.SEMANTIC_IR.supportedVersion());
        ir.put("goal", document.goal().value());
        return ir;
    }

    private GateInput gateInput() {
        if (contracts == null) {
            return null;
        }
        RuntimeContracts loaded = contractLoader.loadRuntimeContracts(CommandSupport.readJson(contracts));
        if (!loaded.hasVerificationContract()) {
            return null;
        }
        GateInput gate = GateInput.of(loaded.verificationContract()).withPolicyProfile(loaded.policyProfile());
        if (status != null) {
            gate = gate.withVerificationStatus(CommandSupport.readJson(status, VerificationStatus.class));
        }
        if (feedback != null) {
            gate = gate.withFeedbackTensor(CommandSupport.readJson(feedback));
        }
        return gate;
    }
}
