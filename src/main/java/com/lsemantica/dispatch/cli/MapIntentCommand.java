package com.lsemantica.dispatch.cli;

import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.intent.IntentMappingOptions;
import com.lsemantica.core.pipeline.intent.IntentMappingService;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica map-intent --snapshot &lt;file&gt; --intent &lt;text&gt;
 * <p>
 * Ranks candidate edit targets for a free-text intent against a snapshot artifact.
 */
@Command(name = "map-intent", mixinStandardHelpOptions = true, description = "Map an intent to ranked edit targets")
@Component
public class MapIntentCommand implements Callable<Integer> {

    @Option(names = "--snapshot", required = true, description = "Workspace snapshot artifact JSON")
    private Path snapshot;

    @Option(names = "--intent", required = true, description = "Free-text change intent")
    private String intent;

    @Option(names = "--intent-source", description = "Where the intent came from (default: user_prompt)")
    private String intentSource;

    @Option(names = "--min-confidence", description = "Minimum confidence for the top candidate")
    private Double minConfidence;

    @Option(names = "--ambiguity-gap", description = "Minimum confidence gap between the top two candidates")
    private Double ambiguityGap;

    @Option(names = "--max-alternatives", description = "Maximum alternatives to keep")
    private Integer maxAlternatives;

    @Option(names = {"--output", "-o"}, description = "Write the artifact here instead of stdout")
    private Path output;

    private final IntentMappingService mappingService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public MapIntentCommand(IntentMappingService mappingService, GovernanceMetrics metrics,
                            GovernanceProperties properties) {
        this.mappingService = mappingService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            IntentMappingOptions options = properties.intentMappingOptions(intent);
            if (intentSource != null) {
                options = options.withIntentSource(intentSource);
            }
            if (minConfidence != null || ambiguityGap != null) {
                options = options.withThresholds(
                        minConfidence != null ? minConfidence : options.minConfidence(),
                        ambiguityGap != null ? ambiguityGap : options.ambiguityGap());
            }
            if (maxAlternatives != null) {
                options = options.withMaxAlternatives(maxAlternatives);
            }

            long started = System.currentTimeMillis();
            IntentMapping mapping = mappingService.map(
                    CommandSupport.readJson(snapshot, WorkspaceSnapshot.class), options);
            metrics.recordPipelineStage(ArtifactType.INTENT_MAPPING, mapping.payload().decision(),
                    System.currentTimeMillis() - started);

            CommandSupport.emit(mapping, output, "intent mapping");
            if (output != null) {
                ConsoleOutput.decision("intent mapping", mapping.payload().decision(), mapping.payload().reasonDetail());
            }
            return CommandSupport.exitCode(mapping.payload().decision());
        });
    }
}
