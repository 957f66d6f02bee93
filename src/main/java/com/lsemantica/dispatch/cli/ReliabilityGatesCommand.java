package com.lsemantica.dispatch.cli;

import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.reliability.ReliabilityCorpus;
import com.lsemantica.core.reliability.ReliabilityCorpusLoader;
import com.lsemantica.core.reliability.ReliabilityGateEvaluator;
import com.lsemantica.core.reliability.ReliabilityGateReport;
import com.lsemantica.core.reliability.ReliabilityThresholds;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica reliability-gates [--corpus &lt;file&gt;] [--thresholds &lt;file&gt;]
 * <p>
 * Replays the failure corpus through the repair loop and scores it against the thresholds.
 * Failing gates only change the exit code when {@code --enforce-thresholds} is set.
 */
@Command(name = "reliability-gates", mixinStandardHelpOptions = true,
        description = "Replay the failure corpus and evaluate reliability gates")
@Component
public class ReliabilityGatesCommand implements Callable<Integer> {

    @Option(names = "--corpus", description = "Failure corpus JSON (default: bundled corpus)")
    private Path corpusPath;

    @Option(names = "--thresholds", description = "Gate thresholds JSON (default: bundled thresholds)")
    private Path thresholdsPath;

    @Option(names = {"--output", "-o"}, description = "Report path (default: ${DEFAULT-VALUE})",
            defaultValue = "reliability-gates-report.json")
    private Path output;

    @Option(names = "--enforce-thresholds", description = "Exit 1 when any gate fails")
    private boolean enforceThresholds;

    private final ReliabilityCorpusLoader loader;
    private final ReliabilityGateEvaluator evaluator;
    private final GovernanceMetrics metrics;

    public ReliabilityGatesCommand(ReliabilityCorpusLoader loader, ReliabilityGateEvaluator evaluator,
                                   GovernanceMetrics metrics) {
        this.loader = loader;
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            ReliabilityCorpus corpus = corpusPath != null ? loader.loadCorpus(corpusPath) : loader.loadDefaultCorpus();
            ReliabilityThresholds thresholds = thresholdsPath != null
                    ? loader.loadThresholds(thresholdsPath)
                    : loader.loadDefaultThresholds();

            ReliabilityGateReport report = evaluator.evaluate(corpus, thresholds);
            metrics.recordReliabilityGateRun(report.gatePass());
            CommandSupport.emit(report, output, "reliability gate report");

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("ok", true);
            summary.put("report_path", output.toString());
            summary.put("fixture_count", report.fixtureCount());
            summary.put("gate_pass", report.gatePass());
            summary.put("failed_metrics", report.aggregate().gates().failedMetrics());
            ConsoleOutput.json(CanonicalJson.writePretty(summary));

            if (!report.gatePass()) {
                ConsoleOutput.error("Reliability gates failed: "
                        + String.join(", ", report.aggregate().gates().failedMetrics()));
                if (enforceThresholds) {
                    return CommandSupport.EXIT_ERROR;
                }
            }
            return CommandSupport.EXIT_OK;
        });
    }
}
