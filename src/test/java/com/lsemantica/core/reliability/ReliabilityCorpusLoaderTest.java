package com.lsemantica.core.reliability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.repair.RepairArtifact;
import com.lsemantica.core.repair.RepairStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReliabilityCorpusLoaderTest {

    private static final String FIXTURE = """
            {
              "id": "parse-missing-goal-quote",
              "failure_class": "parse",
              "scenario": "Closing quote dropped.",
              "recoverability": "recoverable",
              "expected": {"classification": "parse", "continuation_allowed": true},
              "input": {"stage": "compile", "artifact": "ls_source", "excerpt": "goal \\"Ship"}
            }
            """;

    private final ReliabilityCorpusLoader loader = new ReliabilityCorpusLoader();
    private ObjectNode corpus;

    @BeforeEach
    void setUp() {
        corpus = (ObjectNode) CanonicalJson.readTree("""
                {"schema_version": "0.1.0", "corpus_id": "test-corpus", "description": "One fixture.",
                 "fixtures": [%s]}
                """.formatted(FIXTURE));
    }

    private ObjectNode fixture() {
        return (ObjectNode) corpus.get("fixtures").get(0);
    }

    private ReliabilityCorpusException rejected(JsonNode candidate) {
        return assertThrows(ReliabilityCorpusException.class, () -> loader.validateCorpus(candidate));
    }

    @Nested
    @DisplayName("Bundled resources")
    class BundledTests {

        @Test
        @DisplayName("default corpus covers every class in both recoverability buckets")
        void defaultCorpus() {
            ReliabilityCorpus loaded = loader.loadDefaultCorpus();

            assertEquals(ReliabilityCorpus.SCHEMA_VERSION, loaded.schemaVersion());
            assertEquals("lsemantica-failure-corpus-v0", loaded.corpusId());
            assertEquals(14, loaded.fixtures().size());
            assertDoesNotThrow(() -> loader.checkGateCompatibility(loaded, loader.loadDefaultThresholds()));

            ReliabilityCorpus.Fixture first = loaded.fixtures().get(0);
            assertEquals(FailureClass.PARSE, first.failureClass());
            assertEquals(RepairStage.COMPILE, first.input().stage());
            assertEquals(RepairArtifact.LS_SOURCE, first.input().artifact());
            assertEquals(CalibrationBand.HIGH, first.expected().expectedConfidence().calibrationBand());
        }

        @Test
        @DisplayName("default thresholds target the corpus schema version")
        void defaultThresholds() {
            ReliabilityThresholds thresholds = loader.loadDefaultThresholds();

            assertEquals(ReliabilityThresholds.SCHEMA_VERSION, thresholds.schemaVersion());
            assertEquals(ReliabilityCorpus.SCHEMA_VERSION, thresholds.corpusSchemaVersion());
            assertEquals(0.85, thresholds.metrics().recoveryRate());
            assertEquals(1.0, thresholds.metrics().safeBlockRate());
        }

        @Test
        @DisplayName("files are read from disk and parse errors are reported")
        void fromFile(@TempDir Path dir) throws IOException {
            Path good = dir.resolve("corpus.json");
            Files.writeString(good, CanonicalJson.write(corpus));
            Path broken = dir.resolve("broken.json");
            Files.writeString(broken, "{ not json");

            assertEquals("test-corpus", loader.loadCorpus(good).corpusId());
            var parse = assertThrows(ReliabilityCorpusException.class, () -> loader.loadCorpus(broken));
            assertEquals(ReliabilityCorpusException.Code.INVALID_JSON, parse.code());
            var missing = assertThrows(ReliabilityCorpusException.class,
                    () -> loader.loadCorpus(dir.resolve("absent.json")));
            assertEquals(ReliabilityCorpusException.Code.UNREADABLE, missing.code());
        }
    }

    @Nested
    @DisplayName("Corpus validation")
    class CorpusValidationTests {

        @Test
        @DisplayName("string fields are trimmed")
        void trims() {
            fixture().put("id", "  padded-id ");

            assertEquals("padded-id", loader.validateCorpus(corpus).fixtures().get(0).id());
        }

        @Test
        @DisplayName("incompatible schema version is rejected")
        void schemaVersion() {
            corpus.put("schema_version", "0.2.0");

            assertEquals("Reliability corpus schema_version \"0.2.0\" is incompatible; expected \"0.1.0\"",
                    rejected(corpus).getMessage());
        }

        @Test
        @DisplayName("empty fixture list is rejected")
        void emptyFixtures() {
            corpus.putArray("fixtures");

            assertEquals("Reliability corpus fixtures must be a non-empty array", rejected(corpus).getMessage());
        }

        @Test
        @DisplayName("duplicate fixture ids are rejected")
        void duplicateIds() {
            ((ArrayNode) corpus.get("fixtures")).add(fixture().deepCopy());

            assertEquals("Reliability corpus fixture id \"parse-missing-goal-quote\" must be unique",
                    rejected(corpus).getMessage());
        }

        @Test
        @DisplayName("unknown enum values name the field path and allowed values")
        void unknownStage() {
            ((ObjectNode) fixture().get("input")).put("stage", "deploy");

            var ex = rejected(corpus);
            assertEquals(ReliabilityCorpusException.Code.INVALID_CORPUS, ex.code());
            assertTrue(ex.getMessage().startsWith("Reliability corpus field fixtures[0].input.stage must be one of: "));
            assertTrue(ex.getMessage().endsWith("; received \"deploy\""));
        }

        @Test
        @DisplayName("classification must match the failure class")
        void classificationMismatch() {
            ((ObjectNode) fixture().get("expected")).put("classification", "policy_gate");

            assertEquals("Reliability corpus fixture \"parse-missing-goal-quote\" expected.classification must "
                    + "match failure_class", rejected(corpus).getMessage());
        }

        @Test
        @DisplayName("recoverable fixtures must allow continuation")
        void recoverableBlocked() {
            ((ObjectNode) fixture().get("expected")).put("continuation_allowed", false);

            assertTrue(rejected(corpus).getMessage().endsWith("recoverable fixtures must allow continuation"));
        }

        @Test
        @DisplayName("confidence window must be ordered")
        void confidenceWindow() {
            ((ObjectNode) fixture().get("expected")).set("expected_confidence", CanonicalJson.readTree(
                    "{\"score_min\": 0.9, \"score_max\": 0.5, \"calibration_band\": \"high\"}"));

            assertTrue(rejected(corpus).getMessage().contains("score_min must be less than or equal to"));
        }

        @Test
        @DisplayName("non-object input is rejected")
        void nonObject() {
            assertEquals("Reliability corpus field corpus must be an object",
                    rejected(CanonicalJson.readTree("[]")).getMessage());
        }
    }

    @Nested
    @DisplayName("Threshold validation")
    class ThresholdValidationTests {

        @Test
        @DisplayName("rates outside [0, 1] are rejected")
        void outOfRange() {
            JsonNode thresholds = CanonicalJson.readTree("""
                    {"schema_version": "1.0.0", "threshold_id": "t", "corpus_schema_version": "0.1.0",
                     "metrics": {"recovery_rate": 1.5, "safe_block_rate": 1, "safe_allow_rate": 0.9}}
                    """);

            var ex = assertThrows(ReliabilityCorpusException.class, () -> loader.validateThresholds(thresholds));
            assertEquals(ReliabilityCorpusException.Code.INVALID_THRESHOLDS, ex.code());
            assertEquals("Reliability threshold field metrics.recovery_rate must be within [0, 1]; received 1.5",
                    ex.getMessage());
        }

        @Test
        @DisplayName("a corpus version mismatch fails compatibility")
        void versionMismatch() {
            ReliabilityThresholds thresholds = new ReliabilityThresholds("1.0.0", "t", "0.2.0",
                    new ReliabilityThresholds.Metrics(1, 1, 1));

            var ex = assertThrows(ReliabilityCorpusException.class,
                    () -> loader.checkGateCompatibility(loader.validateCorpus(corpus), thresholds));
            assertEquals(ReliabilityCorpusException.Code.THRESHOLD_VERSION_MISMATCH, ex.code());
        }

        @Test
        @DisplayName("missing recoverability buckets fail compatibility")
        void missingCoverage() {
            var ex = assertThrows(ReliabilityCorpusException.class, () -> loader.checkGateCompatibility(
                    loader.validateCorpus(corpus), loader.loadDefaultThresholds()));

            assertEquals(ReliabilityCorpusException.Code.MISSING_COVERAGE, ex.code());
            assertTrue(ex.getMessage().contains("parse:non_recoverable"));
            assertFalse(ex.getMessage().contains("parse:recoverable,"));
            assertTrue(ex.getMessage().contains("stochastic_extraction_uncertainty:recoverable"));
        }
    }
}
