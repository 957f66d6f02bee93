package com.lsemantica.dispatch.cli;

import com.lsemantica.core.config.GovernanceProperties;
import com.lsemantica.core.contract.ContractLoader;
import com.lsemantica.core.contract.NetworkntSchemaValidator;
import com.lsemantica.core.gate.ContinuationGate;
import com.lsemantica.core.metrics.GovernanceMetrics;
import com.lsemantica.core.pipeline.PipelineFixtures;
import com.lsemantica.core.pipeline.bundle.PrBundleService;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.pipeline.intent.IntentMappingService;
import com.lsemantica.core.pipeline.patch.PatchRunService;
import com.lsemantica.core.pipeline.snapshot.GitMetadataReader;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotService;
import com.lsemantica.core.reliability.ReliabilityCorpusLoader;
import com.lsemantica.core.reliability.ReliabilityGateEvaluator;
import com.lsemantica.core.repair.RepairLoop;
import com.lsemantica.core.runtime.SemanticIrRunner;
import com.lsemantica.core.trace.NdjsonSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the L-Semantica CLI command structure, help output and exit codes.
 * Commands are wired with real services; only git metadata is stubbed.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private CommandLine.IFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        GovernanceMetrics metrics = new GovernanceMetrics(registry);
        GovernanceProperties properties = new GovernanceProperties();
        NdjsonSink sink = new NdjsonSink();
        ContractLoader contractLoader = new ContractLoader(new NetworkntSchemaValidator());
        ContinuationGate gate = new ContinuationGate();
        RepairLoop repairLoop = new RepairLoop(sink);
        ReliabilityCorpusLoader corpusLoader = new ReliabilityCorpusLoader();

        GitMetadataReader git = mock(GitMetadataReader.class);
        when(git.read(any())).thenReturn(new GitMetadataReader.GitSummary(
                "0123456789abcdef0123456789abcdef01234567", "main", false, ""));
        WorkspaceSnapshotService snapshots = new WorkspaceSnapshotService(git);
        IntentMappingService mappings = new IntentMappingService();
        SafeDiffPlanService plans = new SafeDiffPlanService();
        PatchRunService patches = new PatchRunService();
        PrBundleService bundles = new PrBundleService();

        factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ValidateCommand.class) return (K) new ValidateCommand(contractLoader);
                if (cls == RepairCommand.class) return (K) new RepairCommand(repairLoop, metrics, properties);
                if (cls == GateCommand.class) return (K) new GateCommand(contractLoader, gate, metrics);
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(contractLoader, new SemanticIrRunner(gate, sink), metrics, properties);
                }
                if (cls == SnapshotCommand.class) return (K) new SnapshotCommand(snapshots, metrics, properties);
                if (cls == MapIntentCommand.class) return (K) new MapIntentCommand(mappings, metrics, properties);
                if (cls == PlanDiffCommand.class) return (K) new PlanDiffCommand(plans, metrics, properties);
                if (cls == PatchRunCommand.class) return (K) new PatchRunCommand(patches, metrics, properties);
                if (cls == PrBundleCommand.class) return (K) new PrBundleCommand(bundles, metrics, properties);
                if (cls == PipelineCommand.class) {
                    return (K) new PipelineCommand(snapshots, mappings, plans, patches, bundles, metrics, properties);
                }
                if (cls == ReliabilityGatesCommand.class) {
                    return (K) new ReliabilityGatesCommand(corpusLoader,
                            new ReliabilityGateEvaluator(repairLoop, corpusLoader), metrics);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream capture = new PrintStream(baos, true);
        try {
            System.setOut(capture);
            System.setErr(capture);
            CommandLine cmd = CliRunner.commandLine(new LsemanticaCommand(), factory);
            int exitCode = cmd.execute(args);
            capture.flush();
            return new CliResult(exitCode, baos.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path example(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = CliTest.class.getResourceAsStream("/examples/" + name)) {
            assertNotNull(in, "missing example resource " + name);
            Files.copy(in, target);
        }
        return target;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : new String[]{"validate", "repair", "gate", "run", "snapshot", "map-intent",
                    "plan-diff", "patch-run", "pr-bundle", "pipeline", "reliability-gates"}) {
                assertTrue(result.output().contains(name), "help should list " + name);
            }
        }

        @Test
        @DisplayName("--version shows the tool version")
        void versionFlag() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("L-Semantica governance 0.1.0"));
        }

        @Test
        @DisplayName("subcommand --help shows its description")
        void subcommandHelp() {
            assertTrue(execute("repair", "--help").output().contains("rule-first repair loop"));
            assertTrue(execute("pipeline", "--help").output().contains("snapshot-to-PR-bundle"));
            assertTrue(execute("reliability-gates", "--help").output().contains("failure corpus"));
        }

        @Test
        @DisplayName("a missing required option is a usage error, not a blocked decision")
        void missingRequiredOption() {
            CliResult result = execute("repair", "--class", "parse");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("--stage"));
        }

        @Test
        @DisplayName("an unknown option exits 1")
        void unknownOption() {
            CliResult result = execute("gate", "--no-such-flag");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("--no-such-flag"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("canonical SemanticIR document is valid")
        void validDocument() throws IOException {
            CliResult result = execute("validate", example("semanticir.canonical.v0.json").toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("SemanticIR contract is valid"));
        }

        @Test
        @DisplayName("document without a goal exits 1")
        void invalidDocument() throws IOException {
            CliResult result = execute("validate", example("semanticir.invalid.missing-goal.json").toString());

            assertEquals(1, result.exitCode());
        }
    }

    @Nested
    @DisplayName("repair")
    class RepairTests {

        @Test
        @DisplayName("repaired failure exits 0 and records the outcome")
        void repaired() {
            CliResult result = execute("repair", "--class", "parse", "--stage", "compile",
                    "--artifact", "ls_source", "--excerpt", "goal \"Ship release");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("PARSE_APPEND_MISSING_QUOTE"));
            assertNotNull(registry.find("lsemantica.repair.outcomes").tag("decision", "repaired").counter());
        }

        @Test
        @DisplayName("escalated failure exits 2")
        void escalated() {
            CliResult result = execute("repair", "--class", "parse", "--stage", "compile",
                    "--artifact", "ls_source", "--excerpt", "goal \"");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("PARSE_TRUNCATED_CONTEXT"));
        }

        @Test
        @DisplayName("unknown failure class exits 1")
        void unknownClass() {
            CliResult result = execute("repair", "--class", "network", "--stage", "compile",
                    "--artifact", "ls_source", "--excerpt", "boom");

            assertEquals(1, result.exitCode());
        }
    }

    @Nested
    @DisplayName("Spring runner exit codes")
    class RunnerTests {

        private int run(String... args) {
            PrintStream originalOut = System.out;
            PrintStream originalErr = System.err;
            PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true);
            try {
                System.setOut(sink);
                System.setErr(sink);
                CliRunner runner = new CliRunner(new LsemanticaCommand(), factory);
                runner.run(args);
                return runner.getExitCode();
            } finally {
                System.setOut(originalOut);
                System.setErr(originalErr);
            }
        }

        @Test
        @DisplayName("escalated repair surfaces as the blocked exit code")
        void escalationIsBlocked() {
            assertEquals(2, run("repair", "--class", "parse", "--stage", "compile",
                    "--artifact", "ls_source", "--excerpt", "goal \""));
        }

        @Test
        @DisplayName("repaired failure exits 0")
        void repairedIsOk() {
            assertEquals(0, run("repair", "--class", "parse", "--stage", "compile",
                    "--artifact", "ls_source", "--excerpt", "goal \"Ship release"));
        }

        @Test
        @DisplayName("usage mistakes exit 1 so they never read as blocked")
        void usageErrorIsNotBlocked() {
            assertEquals(1, run("repair", "--class", "parse"));
        }
    }

    @Nested
    @DisplayName("pipeline")
    class PipelineTests {

        @Test
        @DisplayName("passing verification produces a ready PR bundle")
        void readyBundle() throws IOException {
            Path workspace = Files.createDirectories(tempDir.resolve("workspace"));
            PipelineFixtures.workspace(workspace);
            Path results = example("verification-results.passing.json");
            Path output = tempDir.resolve("out/pipeline.json");

            CliResult result = execute("pipeline", workspace.toString(),
                    "--intent", PipelineFixtures.CAPABILITY_INTENT,
                    "--verification", results.toString(),
                    "-o", output.toString());

            assertEquals(0, result.exitCode(), result.output());
            String artifacts = Files.readString(output);
            assertTrue(artifacts.contains("\"workspace_snapshot\""));
            assertTrue(artifacts.contains("\"pr_bundle\""));
            assertTrue(artifacts.contains("prb_"));
        }

        @Test
        @DisplayName("missing workspace root exits 1")
        void missingRoot() throws IOException {
            Path results = example("verification-results.passing.json");

            CliResult result = execute("pipeline", tempDir.resolve("absent").toString(),
                    "--intent", PipelineFixtures.CAPABILITY_INTENT,
                    "--verification", results.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("WORKSPACE_ROOT_UNREADABLE"));
        }
    }

    @Nested
    @DisplayName("reliability-gates")
    class ReliabilityGatesTests {

        @Test
        @DisplayName("bundled corpus passes and the report is written")
        void bundledCorpus() {
            Path report = tempDir.resolve("reliability-gates-report.json");

            CliResult result = execute("reliability-gates", "-o", report.toString(), "--enforce-thresholds");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("\"gate_pass\" : true"));
            assertTrue(Files.exists(report));
        }
    }
}
