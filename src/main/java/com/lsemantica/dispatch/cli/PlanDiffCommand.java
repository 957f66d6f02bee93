package com.lsemantica.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanOptions;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica plan-diff --mapping &lt;file&gt; [--edits &lt;file&gt;]
 * <p>
 * Builds a safety-checked diff plan from an intent mapping. Without {@code --edits} the
 * plan proposes one edit for the top candidate.
 */
@Command(name = "plan-diff", mixinStandardHelpOptions = true, description = "Build a safe diff plan from an intent mapping")
@Component
public class PlanDiffCommand implements Callable<Integer> {

    private static final TypeReference<List<PlanEdit>> EDIT_LIST = new TypeReference<>() {};

    @Option(names = "--mapping", required = true, description = "Intent mapping artifact JSON")
    private Path mapping;

    @Option(names = "--edits", description = "JSON array of planned edits {path, operation, justification?}")
    private Path edits;

    @Option(names = "--max-file-changes", description = "File change bound")
    private Integer maxFileChanges;

    @Option(names = "--max-hunks", description = "Hunk bound")
    private Integer maxHunks;

    @Option(names = {"--output", "-o"}, description = "Write the artifact here instead of stdout")
    private Path output;

    private final SafeDiffPlanService planService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public PlanDiffCommand(SafeDiffPlanService planService, GovernanceMetrics metrics,
                           GovernanceProperties properties) {
        this.planService = planService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            SafeDiffPlanOptions options = properties.safeDiffPlanOptions();
            if (maxFileChanges != null || maxHunks != null) {
                options = options.withBounds(
                        maxFileChanges != null ? maxFileChanges : options.maxFileChanges(),
                        maxHunks != null ? maxHunks : options.maxHunks());
            }
            if (edits != null) {
                options = options.withPlannedEdits(CommandSupport.readJson(edits, EDIT_LIST));
            }

            long started = System.currentTimeMillis();
            SafeDiffPlan plan = planService.plan(CommandSupport.readJson(mapping, IntentMapping.class), options);
            metrics.recordPipelineStage(ArtifactType.SAFE_DIFF_PLAN, plan.payload().decision(),
                    System.currentTimeMillis() - started);

            CommandSupport.emit(plan, output, "safe diff plan");
            if (output != null) {
                ConsoleOutput.decision("safe diff plan", plan.payload().decision(), plan.payload().reasonDetail());
            }
            return CommandSupport.exitCode(plan.payload().decision());
        });
    }
}
