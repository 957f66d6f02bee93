package com.lsemantica.core.pipeline.snapshot;

import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.trace.GovernanceHooks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceSnapshotServiceTest {

    private static final GitMetadataReader.GitSummary CLEAN =
            new GitMetadataReader.GitSummary("a".repeat(40), "main", false, "");

    @TempDir
    Path workspace;

    private WorkspaceSnapshotService service;

    @BeforeEach
    void setUp() throws IOException {
        service = new WorkspaceSnapshotService(root -> CLEAN);
        Files.createDirectories(workspace.resolve("src"));
        Files.createDirectories(workspace.resolve("node_modules/pkg"));
        Files.createDirectories(workspace.resolve("docs"));
        Files.writeString(workspace.resolve("src/app.ts"), "export const x = 1;\n");
        Files.writeString(workspace.resolve("src/Main.java"), "class Main {}\n");
        Files.writeString(workspace.resolve("docs/README.md"), "# Readme\n");
        Files.writeString(workspace.resolve("LICENSE"), "MIT\n");
        Files.writeString(workspace.resolve("node_modules/pkg/index.js"), "module.exports = 1;\n");
    }

    private WorkspaceSnapshotOptions options() {
        return WorkspaceSnapshotOptions.of(workspace.toString())
                .withHooks(GovernanceHooks.fixed(Instant.parse("2026-02-22T10:00:00Z"), "run-snap-1"));
    }

    @Nested
    @DisplayName("Capture")
    class CaptureTests {

        @Test
        @DisplayName("builds the envelope and inventory with default ignores")
        void capturesInventory() {
            WorkspaceSnapshot snapshot = service.capture(options());

            assertEquals(ArtifactType.WORKSPACE_SNAPSHOT.typeId(), snapshot.artifactType());
            assertEquals("1.0.0", snapshot.schemaVersion());
            assertTrue(snapshot.artifactId().startsWith("wsnap_"));
            assertEquals("run-snap-1", snapshot.runId());
            assertEquals("2026-02-22T10:00:00.000Z", snapshot.producedAtUtc());
            assertTrue(snapshot.inputs().isEmpty());
            assertEquals(WorkspaceSnapshot.TRACE_SOURCE, snapshot.trace().source());

            WorkspaceSnapshot.Inventory inventory = snapshot.payload().inventory();
            assertEquals(4, inventory.filesScanned());
            assertEquals(3, inventory.filesSupported());
            assertEquals(List.of("Java", "Markdown", "TypeScript"), inventory.languages());
            assertEquals(WorkspaceSnapshotService.DEFAULT_IGNORED_PATHS,
                    snapshot.payload().filters().ignoredPaths());
            assertTrue(snapshot.payload().snapshotHash().startsWith("sha256:"));
            assertEquals("main", snapshot.payload().git().branch());
        }

        @Test
        @DisplayName("identical content yields identical id and hash across runs")
        void deterministicHash() {
            WorkspaceSnapshot first = service.capture(options());
            WorkspaceSnapshot second = service.capture(WorkspaceSnapshotOptions.of(workspace.toString()));

            assertEquals(first.artifactId(), second.artifactId());
            assertEquals(first.payload().snapshotHash(), second.payload().snapshotHash());
        }

        @Test
        @DisplayName("file changes and dirty state change the hash")
        void hashTracksContent() throws IOException {
            String before = service.capture(options()).payload().snapshotHash();
            Files.writeString(workspace.resolve("src/app.ts"), "export const x = 22;\n");
            String afterEdit = service.capture(options()).payload().snapshotHash();

            WorkspaceSnapshotService dirty = new WorkspaceSnapshotService(root ->
                    new GitMetadataReader.GitSummary("a".repeat(40), "main", true, " M src/app.ts"));
            String afterDirty = dirty.capture(options()).payload().snapshotHash();

            assertNotEquals(before, afterEdit);
            assertNotEquals(afterEdit, afterDirty);
        }

        @Test
        @DisplayName("custom ignore patterns are normalized and replace the defaults")
        void customIgnores() {
            WorkspaceSnapshot snapshot = service.capture(options()
                    .withIgnoredPaths(List.of(" docs/** ", "LICENSE", "docs/**")));

            assertEquals(List.of("LICENSE", "docs/**"), snapshot.payload().filters().ignoredPaths());
            assertEquals(3, snapshot.payload().inventory().filesScanned());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("blank root is INVALID_WORKSPACE_ROOT")
        void blankRoot() {
            var ex = assertThrows(WorkspaceSnapshotException.class,
                    () -> service.capture(WorkspaceSnapshotOptions.of("  ")));
            assertEquals(WorkspaceSnapshotException.Code.INVALID_WORKSPACE_ROOT, ex.code());
        }

        @Test
        @DisplayName("missing root is WORKSPACE_ROOT_UNREADABLE")
        void missingRoot() {
            var ex = assertThrows(WorkspaceSnapshotException.class,
                    () -> service.capture(WorkspaceSnapshotOptions.of(workspace.resolve("nope").toString())));
            assertEquals(WorkspaceSnapshotException.Code.WORKSPACE_ROOT_UNREADABLE, ex.code());
        }

        @Test
        @DisplayName("a file root is WORKSPACE_ROOT_NOT_DIRECTORY")
        void fileRoot() {
            var ex = assertThrows(WorkspaceSnapshotException.class,
                    () -> service.capture(WorkspaceSnapshotOptions.of(workspace.resolve("LICENSE").toString())));
            assertEquals(WorkspaceSnapshotException.Code.WORKSPACE_ROOT_NOT_DIRECTORY, ex.code());
            assertEquals("WORKSPACE_ROOT_NOT_DIRECTORY", ex.codeName());
        }

        @Test
        @DisplayName("blank ignore pattern is INVALID_IGNORED_PATHS")
        void blankIgnore() {
            var ex = assertThrows(WorkspaceSnapshotException.class,
                    () -> service.capture(options().withIgnoredPaths(List.of("ok/**", " "))));
            assertEquals(WorkspaceSnapshotException.Code.INVALID_IGNORED_PATHS, ex.code());
        }

        @Test
        @DisplayName("git failures propagate from the metadata reader")
        void gitFailure() {
            WorkspaceSnapshotService noGit = new WorkspaceSnapshotService(root -> {
                throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE,
                        "not a git repository", root.toString());
            });

            var ex = assertThrows(WorkspaceSnapshotException.class, () -> noGit.capture(options()));
            assertEquals(WorkspaceSnapshotException.Code.GIT_METADATA_UNAVAILABLE, ex.code());
        }
    }

    @Test
    @DisplayName("languages are detected by extension, case-insensitively")
    void languageDetection() {
        assertEquals("Java", WorkspaceSnapshotService.languageOf("src/A.JAVA"));
        assertEquals("L-Semantica", WorkspaceSnapshotService.languageOf("examples/first.ls"));
        assertNull(WorkspaceSnapshotService.languageOf("LICENSE"));
        assertNull(WorkspaceSnapshotService.languageOf(".gitignore"));
    }
}
