package com.lsemantica.dispatch.cli;

import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.logging.MdcContext;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.repair.RepairLoop;
import com.lsemantica.core.repair.RepairOptions;
import com.lsemantica.core.repair.RepairRequest;
import com.lsemantica.core.repair.RepairResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica repair --class &lt;failure-class&gt; --stage &lt;stage&gt; --artifact &lt;artifact&gt; --excerpt &lt;text&gt;
 * <p>
 * Runs the rule-first repair loop on one classified failure. Exits 0 when repaired and 2
 * when the loop escalates or stops.
 */
@Command(name = "repair", mixinStandardHelpOptions = true, description = "Run the rule-first repair loop on a failure")
@Component
public class RepairCommand implements Callable<Integer> {

    @Option(names = "--class", required = true, description = "Failure class, e.g. parse or policy_gate")
    private String failureClass;

    @Option(names = "--stage", required = true, description = "compile, contract_load, policy_gate, runtime or extraction")
    private String stage;

    @Option(names = "--artifact", required = true, description = "Failing artifact, e.g. ls_source or model_output")
    private String artifact;

    @Option(names = "--excerpt", required = true, description = "Failure excerpt")
    private String excerpt;

    @Option(names = "--max-attempts", description = "Attempt budget (1-10)")
    private Integer maxAttempts;

    @Option(names = "--feedback-out", description = "Append the FeedbackTensor record to this NDJSON file")
    private Path feedbackOut;

    @Option(names = "--inspection-out", description = "Append the trace inspection entry to this NDJSON file")
    private Path inspectionOut;

    @Option(names = "--report-out", description = "Append the human-readable inspection report to this file")
    private Path reportOut;

    @Option(names = {"--output", "-o"}, description = "Write the repair result JSON here instead of stdout")
    private Path output;

    private final RepairLoop repairLoop;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public RepairCommand(RepairLoop repairLoop, GovernanceMetrics metrics, GovernanceProperties properties) {
        this.repairLoop = repairLoop;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            RepairRequest request = RepairRequest.parse(failureClass, stage, artifact, excerpt);
            GovernanceProperties.Trace trace = properties.getTrace();
            RepairOptions options = RepairOptions.defaults()
                    .withMaxAttempts(maxAttempts != null ? maxAttempts : properties.getRepair().getMaxAttempts())
                    .withFeedbackTensorPath(feedbackOut != null ? feedbackOut : trace.getFeedbackTensorPath())
                    .withTraceInspection(inspectionOut != null ? inspectionOut : trace.getInspectionPath(),
                            reportOut != null ? reportOut : trace.getInspectionReportPath());

            MdcContext.setStage(request.target());
            RepairResult result;
            try {
                result = repairLoop.run(request, options);
            } finally {
                MdcContext.clear();
            }
            metrics.recordRepairOutcome(result);

            CommandSupport.emit(result, output, "repair result");
            return result.continuationAllowed() ? CommandSupport.EXIT_OK : CommandSupport.EXIT_BLOCKED;
        });
    }
}
