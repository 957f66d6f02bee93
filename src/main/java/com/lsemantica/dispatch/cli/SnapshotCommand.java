package com.lsemantica.dispatch.cli;

import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotOptions;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica snapshot &lt;root&gt;
 * <p>
 * Captures a workspace snapshot artifact. A snapshot carries no decision, so a successful
 * capture always exits 0.
 */
@Command(name = "snapshot", mixinStandardHelpOptions = true, description = "Capture a workspace snapshot artifact")
@Component
public class SnapshotCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workspace root directory")
    private String root;

    @Option(names = "--ignore", description = "Ignored path glob (repeatable); replaces the defaults")
    private List<String> ignored;

    @Option(names = {"--output", "-o"}, description = "Write the artifact here instead of stdout")
    private Path output;

    private final WorkspaceSnapshotService snapshotService;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;

    public SnapshotCommand(WorkspaceSnapshotService snapshotService, GovernanceMetrics metrics,
                           GovernanceProperties properties) {
        this.snapshotService = snapshotService;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            long started = System.currentTimeMillis();
            WorkspaceSnapshot snapshot = snapshotService.capture(WorkspaceSnapshotOptions.of(root)
                    .withIgnoredPaths(ignored)
                    .withToolVersion(properties.getToolVersion()));
            metrics.recordPipelineStage(ArtifactType.WORKSPACE_SNAPSHOT, null, System.currentTimeMillis() - started);
            CommandSupport.emit(snapshot, output, "workspace snapshot");
            return CommandSupport.EXIT_OK;
        });
    }
}
