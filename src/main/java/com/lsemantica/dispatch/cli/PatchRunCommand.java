package com.lsemantica.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.patch.PatchRun;
import com.lsemantica.core.pipeline.patch.PatchRunOptions;
import com.lsemantica.core.pipeline.patch.PatchRunService;
import com.lsemantica.core.pipeline.patch.VerificationResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica patch-run --plan &lt;file&gt; --verification &lt;file&gt;
 * <p>
 * Materializes the plan's patch and gates it on the supplied verification results.
 */
@Command(name = "patch-run", mixinStandardHelpOptions = true, description = "Materialize and gate a patch from a diff plan")
@Component
public class PatchRunCommand implements Callable<Integer> {

    static final TypeReference<List<VerificationResult>> RESULT_LIST = new TypeReference<>() {};

    @Option(names = "--plan", required = true, description = "Safe diff plan artifact JSON")
    private Path plan;

    @Option(names = "--verification", required = true,
            description = "JSON array of verification results {check, status, evidence_ref, detail?}")
    private Path verification;

    @Option(names = "--required-check", description = "Required check name (repeatable); replaces the defaults")
    private List<String> requiredChecks;

    @Option(names = {"--output", "-o"}, description = "Write the artifact here instead of stdout")
    private Path output;

    private final PatchRunService patchRunService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public PatchRunCommand(PatchRunService patchRunService, GovernanceMetrics metrics,
                           GovernanceProperties properties) {
        this.patchRunService = patchRunService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            PatchRunOptions options = properties.patchRunOptions(CommandSupport.readJson(verification, RESULT_LIST));
            if (requiredChecks != null) {
                options = options.withRequiredChecks(requiredChecks);
            }

            long started = System.currentTimeMillis();
            PatchRun run = patchRunService.run(CommandSupport.readJson(plan, SafeDiffPlan.class), options);
            metrics.recordPipelineStage(ArtifactType.PATCH_RUN, run.payload().decision(),
                    System.currentTimeMillis() - started);

            CommandSupport.emit(run, output, "patch run");
            if (output != null) {
                ConsoleOutput.decision("patch run", run.payload().decision(), run.payload().reasonDetail());
            }
            return CommandSupport.exitCode(run.payload().decision());
        });
    }
}
