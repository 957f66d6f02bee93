package com.lsemantica.core.pipeline.intent;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.PipelineFixtures;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentMappingServiceTest {

    @TempDir
    Path workspace;

    private final IntentMappingService service = new IntentMappingService();
    private WorkspaceSnapshot snapshot;

    @BeforeEach
    void setUp() {
        PipelineFixtures.workspace(workspace);
        snapshot = PipelineFixtures.snapshot(workspace);
    }

    @Nested
    @DisplayName("Decisions")
    class DecisionTests {

        @Test
        @DisplayName("a named capability is selected from the .ls AST")
        void selectsCapability() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT));

            assertEquals(Decision.CONTINUE, mapping.payload().decision());
            assertEquals(ReasonCode.OK, mapping.payload().reasonCode());
            assertEquals(1, mapping.payload().candidates().size());
            IntentMapping.Candidate top = mapping.payload().candidates().get(0);
            assertEquals("specs/release.ls", top.path());
            assertEquals("capability:write_notes", top.symbolPath());
            assertEquals(ExtractionMethod.AST_SYMBOL_LOOKUP, top.provenance().method());
            assertEquals(2, top.provenance().range().startLine());
            assertTrue(top.confidence() >= IntentMappingService.DEFAULT_MIN_CONFIDENCE);
            assertTrue(top.rationale().contains("exact symbol-name hit"));
            assertTrue(top.targetId().startsWith("specs/release.ls#capability:write_notes_"));
            assertFalse(mapping.payload().alternatives().isEmpty());
        }

        @Test
        @DisplayName("the envelope references the snapshot and inherits its run id")
        void envelope() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT));

            assertEquals(ArtifactType.INTENT_MAPPING.typeId(), mapping.artifactType());
            assertTrue(mapping.artifactId().startsWith("imap_"));
            assertEquals(PipelineFixtures.RUN_ID, mapping.runId());
            assertEquals(List.of(snapshot.ref()), mapping.inputs());
            assertEquals(IntentMappingService.DEFAULT_INTENT_SOURCE, mapping.trace().intentSource());
        }

        @Test
        @DisplayName("identical inputs produce the identical artifact id")
        void deterministicId() {
            IntentMapping first = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT));
            IntentMapping second = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT));

            assertEquals(first.artifactId(), second.artifactId());
            assertEquals(first.payload(), second.payload());
        }

        @Test
        @DisplayName("several targets within the gap escalate as ambiguous")
        void ambiguous() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of("release"));

            assertEquals(Decision.ESCALATE, mapping.payload().decision());
            assertEquals(ReasonCode.MAPPING_AMBIGUOUS, mapping.payload().reasonCode());
            assertTrue(mapping.payload().candidates().size() > 1);
            assertTrue(mapping.payload().reasonDetail().startsWith("Multiple high-confidence targets"));
        }

        @Test
        @DisplayName("a top candidate under the floor escalates as low confidence")
        void lowConfidence() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT)
                    .withThresholds(0.99, null));

            assertEquals(Decision.ESCALATE, mapping.payload().decision());
            assertEquals(ReasonCode.MAPPING_LOW_CONFIDENCE, mapping.payload().reasonCode());
            assertEquals(1, mapping.payload().candidates().size());
            assertTrue(mapping.payload().reasonDetail().contains("below minimum confidence 0.9900"));
        }

        @Test
        @DisplayName("no matching target stops as unsupported input")
        void noMatch() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of("zebra quantum"));

            assertEquals(Decision.STOP, mapping.payload().decision());
            assertEquals(ReasonCode.UNSUPPORTED_INPUT, mapping.payload().reasonCode());
            assertTrue(mapping.payload().candidates().isEmpty());
            assertEquals(List.of(ExtractionMethod.AST_SYMBOL_LOOKUP, ExtractionMethod.TEXT_MATCH),
                    mapping.trace().extractionMethods());
        }

        @Test
        @DisplayName("paths that sanitize to the same readable id keep distinct target ids")
        void distinctTargetIds() throws IOException {
            Files.writeString(workspace.resolve("src/a b.ts"), "rotate ledger keys\n");
            Files.writeString(workspace.resolve("src/a_b.ts"), "rotate ledger keys\n");
            WorkspaceSnapshot current = PipelineFixtures.snapshot(workspace);

            IntentMapping mapping = service.map(current, IntentMappingOptions.of("rotate ledger keys"));

            List<IntentMapping.Candidate> all = new ArrayList<>(mapping.payload().candidates());
            all.addAll(mapping.payload().alternatives());
            List<String> ids = all.stream()
                    .filter(c -> c.path().equals("src/a b.ts") || c.path().equals("src/a_b.ts"))
                    .map(IntentMapping.Candidate::targetId)
                    .toList();
            assertEquals(2, ids.size());
            assertNotEquals(ids.get(0), ids.get(1));
            assertTrue(ids.stream().allMatch(id -> id.startsWith("src/a_b.ts#file_")));
        }

        @Test
        @DisplayName("target ids differ when only the raw path differs")
        void targetIdDigest() {
            String spaced = IntentMappingService.targetId("src/a b.ts", null);
            String underscored = IntentMappingService.targetId("src/a_b.ts", null);

            assertNotEquals(spaced, underscored);
            assertEquals(spaced, IntentMappingService.targetId("src/a b.ts", null));
        }

        @Test
        @DisplayName("alternatives are capped by maxAlternatives")
        void alternativesCap() {
            IntentMapping mapping = service.map(snapshot, IntentMappingOptions.of(PipelineFixtures.CAPABILITY_INTENT)
                    .withMaxAlternatives(0));

            assertTrue(mapping.payload().alternatives().isEmpty());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTests {

        @Test
        @DisplayName("blank intent is rejected")
        void blankIntent() {
            var ex = assertThrows(IntentMappingException.class,
                    () -> service.map(snapshot, IntentMappingOptions.of("   ")));
            assertEquals(IntentMappingException.Code.INVALID_INTENT, ex.code());
        }

        @Test
        @DisplayName("blank intent source is rejected when provided")
        void blankSource() {
            var ex = assertThrows(IntentMappingException.class,
                    () -> service.map(snapshot, IntentMappingOptions.of("x").withIntentSource(" ")));
            assertEquals(IntentMappingException.Code.INVALID_INTENT_SOURCE, ex.code());
        }

        @Test
        @DisplayName("thresholds outside [0, 1] are rejected")
        void thresholds() {
            var ex = assertThrows(IntentMappingException.class,
                    () -> service.map(snapshot, IntentMappingOptions.of("x").withThresholds(1.5, null)));
            assertEquals(IntentMappingException.Code.INVALID_OPTIONS, ex.code());
        }

        @Test
        @DisplayName("a missing snapshot is rejected")
        void missingSnapshot() {
            var ex = assertThrows(IntentMappingException.class,
                    () -> service.map(null, IntentMappingOptions.of("x")));
            assertEquals(IntentMappingException.Code.INVALID_WORKSPACE_SNAPSHOT, ex.code());
            assertEquals("Intent mapping requires a workspace snapshot artifact object", ex.getMessage());
        }
    }

    @Test
    @DisplayName("search text drops stop words and splits identifiers")
    void searchText() {
        assertEquals("write notes to the file", SearchText.normalize("Write_Notes to-the FILE!"));
        assertEquals(List.of("file", "notes", "write"), SearchText.tokenize("Write_Notes to the FILE"));
    }
}
