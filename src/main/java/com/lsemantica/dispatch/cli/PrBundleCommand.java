package com.lsemantica.dispatch.cli;

import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.bundle.PrBundle;
import com.lsemantica.core.pipeline.bundle.PrBundleOptions;
import com.lsemantica.core.pipeline.bundle.PrBundleService;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.patch.PatchRun;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica pr-bundle --patch-run &lt;file&gt; [--snapshot --mapping --plan]
 * <p>
 * Assembles the human-reviewable PR bundle. Without all three lineage artifacts the bundle
 * is marked incomplete and readiness stops.
 */
@Command(name = "pr-bundle", mixinStandardHelpOptions = true, description = "Assemble a PR bundle from a patch run")
@Component
public class PrBundleCommand implements Callable<Integer> {

    @Option(names = "--patch-run", required = true, description = "Patch run artifact JSON")
    private Path patchRun;

    @Option(names = "--snapshot", description = "Workspace snapshot artifact JSON")
    private Path snapshot;

    @Option(names = "--mapping", description = "Intent mapping artifact JSON")
    private Path mapping;

    @Option(names = "--plan", description = "Safe diff plan artifact JSON")
    private Path plan;

    @Option(names = "--summary", description = "Change summary")
    private String summary;

    @Option(names = "--rationale", description = "Change rationale")
    private String rationale;

    @Option(names = "--risk", description = "Risk or tradeoff note (repeatable)")
    private List<String> risks;

    @Option(names = "--evidence-ref", description = "Verification evidence link")
    private String evidenceRef;

    @Option(names = {"--output", "-o"}, description = "Write the artifact here instead of stdout")
    private Path output;

    private final PrBundleService bundleService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public PrBundleCommand(PrBundleService bundleService, GovernanceMetrics metrics, GovernanceProperties properties) {
        this.bundleService = bundleService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            PrBundleOptions.Lineage lineage = new PrBundleOptions.Lineage(
                    snapshot == null ? null : CommandSupport.readJson(snapshot, WorkspaceSnapshot.class),
                    mapping == null ? null : CommandSupport.readJson(mapping, IntentMapping.class),
                    plan == null ? null : CommandSupport.readJson(plan, SafeDiffPlan.class));
            PrBundleOptions options = PrBundleOptions.of(lineage)
                    .withSummary(summary, rationale)
                    .withToolVersion(properties.getToolVersion());
            if (risks != null) {
                options = options.withRiskTradeoffs(risks);
            }
            if (evidenceRef != null) {
                options = options.withVerificationEvidenceRef(evidenceRef);
            }

            long started = System.currentTimeMillis();
            PrBundle bundle = bundleService.bundle(CommandSupport.readJson(patchRun, PatchRun.class), options);
            PrBundle.Readiness readiness = bundle.payload().readiness();
            metrics.recordPipelineStage(ArtifactType.PR_BUNDLE, readiness.decision(),
                    System.currentTimeMillis() - started);

            CommandSupport.emit(bundle, output, "PR bundle");
            if (output != null) {
                ConsoleOutput.decision("pr bundle", readiness.decision(), readiness.reasonDetail());
            }
            return CommandSupport.exitCode(readiness.decision());
        });
    }
}
