package com.lsemantica.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.logging.MdcContext;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactStore;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.bundle.PrBundle;
import com.lsemantica.core.pipeline.bundle.PrBundleOptions;
import com.lsemantica.core.pipeline.bundle.PrBundleService;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanOptions;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.intent.IntentMappingService;
import com.lsemantica.core.pipeline.patch.PatchRun;
import com.lsemantica.core.pipeline.patch.PatchRunService;
import com.lsemantica.core.pipeline.patch.VerificationResult;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotOptions;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica pipeline &lt;root&gt; --intent "..." --verification &lt;file&gt;
 * <p>
 * Runs snapshot, intent mapping, diff planning, patch run and PR bundling in one pass.
 * A blocked stage does not abort the run: its decision propagates downstream and the bundle
 * records why readiness stopped.
 */
@Command(name = "pipeline", mixinStandardHelpOptions = true,
        description = "Run the full snapshot-to-PR-bundle artifact pipeline")
@Component
public class PipelineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommand.class);

    private static final TypeReference<List<PlanEdit>> EDIT_LIST = new TypeReference<>() {};

    @Parameters(index = "0", description = "Workspace root directory")
    private String root;

    @Option(names = "--intent", required = true, description = "Natural-language change intent")
    private String intent;

    @Option(names = "--verification", required = true, description = "JSON array of verification results")
    private Path verification;

    @Option(names = "--edits", description = "JSON array of planned edits overriding the derived edit")
    private Path edits;

    @Option(names = "--summary", description = "Change summary for the PR bundle")
    private String summary;

    @Option(names = "--rationale", description = "Change rationale for the PR bundle")
    private String rationale;

    @Option(names = {"--output", "-o"}, description = "Write all five artifacts here instead of stdout")
    private Path output;

    private final WorkspaceSnapshotService snapshotService;
    private final IntentMappingService mappingService;
    private final SafeDiffPlanService planService;
    private final PatchRunService patchRunService;
    private final PrBundleService bundleService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public PipelineCommand(WorkspaceSnapshotService snapshotService, IntentMappingService mappingService,
                           SafeDiffPlanService planService, PatchRunService patchRunService,
                           PrBundleService bundleService, GovernanceMetrics metrics,
                           GovernanceProperties properties) {
        this.snapshotService = snapshotService;
        this.mappingService = mappingService;
        this.planService = planService;
        this.patchRunService = patchRunService;
        this.bundleService = bundleService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            try {
                return runPipeline();
            } finally {
                MdcContext.clear();
            }
        });
    }

    private int runPipeline() {
        List<VerificationResult> results = CommandSupport.readJson(verification, PatchRunCommand.RESULT_LIST);
        ArtifactStore store = new ArtifactStore();

        long started = System.currentTimeMillis();
        WorkspaceSnapshot snapshot = store.put(snapshotService.capture(WorkspaceSnapshotOptions.of(root)
                .withToolVersion(properties.getToolVersion())));
        finish(ArtifactType.WORKSPACE_SNAPSHOT, snapshot.runId(), snapshot.artifactId(), null, started);

        started = System.currentTimeMillis();
        IntentMapping mapping = store.put(mappingService.map(snapshot, properties.intentMappingOptions(intent)));
        finish(ArtifactType.INTENT_MAPPING, mapping.runId(), mapping.artifactId(),
                mapping.payload().decision(), started);

        started = System.currentTimeMillis();
        SafeDiffPlanOptions planOptions = properties.safeDiffPlanOptions();
        if (edits != null) {
            planOptions = planOptions.withPlannedEdits(CommandSupport.readJson(edits, EDIT_LIST));
        }
        SafeDiffPlan plan = store.put(planService.plan(mapping, planOptions));
        finish(ArtifactType.SAFE_DIFF_PLAN, plan.runId(), plan.artifactId(), plan.payload().decision(), started);

        started = System.currentTimeMillis();
        PatchRun patchRun = store.put(patchRunService.run(plan, properties.patchRunOptions(results)));
        finish(ArtifactType.PATCH_RUN, patchRun.runId(), patchRun.artifactId(),
                patchRun.payload().decision(), started);

        started = System.currentTimeMillis();
        PrBundle bundle = store.put(bundleService.bundle(patchRun,
                PrBundleOptions.of(new PrBundleOptions.Lineage(snapshot, mapping, plan))
                        .withSummary(summary, rationale)
                        .withToolVersion(properties.getToolVersion())));
        Decision readiness = bundle.payload().readiness().decision();
        finish(ArtifactType.PR_BUNDLE, bundle.runId(), bundle.artifactId(), readiness, started);

        log.info("Pipeline run {} produced {} artifacts, lineage depth {}", bundle.runId(), store.size(),
                store.lineage(bundle.artifactId()).size());

        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("workspace_snapshot", snapshot);
        artifacts.put("intent_mapping", mapping);
        artifacts.put("safe_diff_plan", plan);
        artifacts.put("patch_run", patchRun);
        artifacts.put("pr_bundle", bundle);
        CommandSupport.emit(artifacts, output, "pipeline artifacts");
        if (output != null) {
            ConsoleOutput.decision("pr bundle", readiness, bundle.payload().readiness().reasonDetail());
        }
        return CommandSupport.exitCode(readiness);
    }

    private void finish(ArtifactType stage, String runId, String artifactId, Decision decision, long started) {
        MdcContext.setArtifact(runId, stage.label(), artifactId);
        long elapsed = System.currentTimeMillis() - started;
        metrics.recordPipelineStage(stage, decision, elapsed);
        log.info("Stage {} finished in {}ms with decision {}", stage.typeId(), elapsed,
                decision == null ? "none" : decision.wireValue());
    }
}
