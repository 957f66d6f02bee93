package com.lsemantica.core.reliability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.model.CalibrationBand;
import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.model.WireValue;
import com.lsemantica.core.repair.RepairArtifact;
import com.lsemantica.core.repair.RepairStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and validates the reliability fixture corpus and its gate thresholds.
 * <p>
 * Validation walks the raw JSON tree rather than binding it, so every error names the exact
 * field path that failed. The first problem found is reported.
 */
@Component
public class ReliabilityCorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityCorpusLoader.class);

    public static final String DEFAULT_CORPUS_RESOURCE = "/reliability/failure-corpus.v0.json";
    public static final String DEFAULT_THRESHOLDS_RESOURCE = "/reliability/reliability-gates-thresholds.v1.json";

    private static final FieldChecks CORPUS_FIELDS =
            new FieldChecks("Reliability corpus field ", ReliabilityCorpusException.Code.INVALID_CORPUS);
    private static final FieldChecks THRESHOLD_FIELDS =
            new FieldChecks("Reliability threshold field ", ReliabilityCorpusException.Code.INVALID_THRESHOLDS);

    public ReliabilityCorpus loadCorpus(Path path) {
        ReliabilityCorpus corpus = validateCorpus(readFile(path, "reliability corpus"));
        log.debug("Loaded reliability corpus {} ({} fixtures) from {}", corpus.corpusId(),
                corpus.fixtures().size(), path);
        return corpus;
    }

    public ReliabilityCorpus loadDefaultCorpus() {
        return validateCorpus(readResource(DEFAULT_CORPUS_RESOURCE, "reliability corpus"));
    }

    public ReliabilityThresholds loadThresholds(Path path) {
        return validateThresholds(readFile(path, "reliability thresholds"));
    }

    public ReliabilityThresholds loadDefaultThresholds() {
        return validateThresholds(readResource(DEFAULT_THRESHOLDS_RESOURCE, "reliability thresholds"));
    }

    // --- corpus ---

    public ReliabilityCorpus validateCorpus(JsonNode candidate) {
        FieldChecks fields = CORPUS_FIELDS;
        fields.object(candidate, "corpus");

        String schemaVersion = fields.nonEmptyString(candidate.get("schema_version"), "schema_version");
        if (!ReliabilityCorpus.SCHEMA_VERSION.equals(schemaVersion)) {
            throw corpusError("Reliability corpus schema_version \"" + schemaVersion
                    + "\" is incompatible; expected \"" + ReliabilityCorpus.SCHEMA_VERSION + "\"");
        }
        String corpusId = fields.nonEmptyString(candidate.get("corpus_id"), "corpus_id");
        String description = fields.nonEmptyString(candidate.get("description"), "description");

        JsonNode fixturesNode = candidate.get("fixtures");
        if (fixturesNode == null || !fixturesNode.isArray() || fixturesNode.isEmpty()) {
            throw corpusError("Reliability corpus fixtures must be a non-empty array");
        }

        Set<String> seenIds = new HashSet<>();
        List<ReliabilityCorpus.Fixture> fixtures = new ArrayList<>();
        for (int index = 0; index < fixturesNode.size(); index++) {
            fixtures.add(validateFixture(fields, fixturesNode.get(index), "fixtures[" + index + "]", seenIds));
        }
        return new ReliabilityCorpus(schemaVersion, corpusId, description, fixtures);
    }

    private ReliabilityCorpus.Fixture validateFixture(FieldChecks fields, JsonNode fixture, String path,
                                                      Set<String> seenIds) {
        fields.object(fixture, path);

        String id = fields.nonEmptyString(fixture.get("id"), path + ".id");
        if (!seenIds.add(id)) {
            throw corpusError("Reliability corpus fixture id \"" + id + "\" must be unique");
        }
        FailureClass failureClass = fields.oneOf(FailureClass.class, fixture.get("failure_class"),
                path + ".failure_class");
        String scenario = fields.nonEmptyString(fixture.get("scenario"), path + ".scenario");
        Recoverability recoverability = fields.oneOf(Recoverability.class, fixture.get("recoverability"),
                path + ".recoverability");

        JsonNode expectedNode = fixture.get("expected");
        fields.object(expectedNode, path + ".expected");
        FailureClass classification = fields.oneOf(FailureClass.class, expectedNode.get("classification"),
                path + ".expected.classification");
        boolean continuationAllowed = fields.bool(expectedNode.get("continuation_allowed"),
                path + ".expected.continuation_allowed");
        ReliabilityCorpus.ExpectedConfidence confidence = null;
        if (expectedNode.has("expected_confidence")) {
            confidence = validateConfidence(fields, expectedNode.get("expected_confidence"),
                    path + ".expected.expected_confidence", id);
        }

        if (classification != failureClass) {
            throw corpusError("Reliability corpus fixture \"" + id
                    + "\" expected.classification must match failure_class");
        }
        if (recoverability == Recoverability.RECOVERABLE && !continuationAllowed) {
            throw corpusError("Reliability corpus fixture \"" + id + "\" recoverable fixtures must allow continuation");
        }
        if (recoverability == Recoverability.NON_RECOVERABLE && continuationAllowed) {
            throw corpusError("Reliability corpus fixture \"" + id
                    + "\" non_recoverable fixtures must block continuation");
        }

        JsonNode inputNode = fixture.get("input");
        fields.object(inputNode, path + ".input");
        RepairStage stage = fields.oneOf(RepairStage.class, inputNode.get("stage"), path + ".input.stage");
        RepairArtifact artifact = fields.oneOf(RepairArtifact.class, inputNode.get("artifact"),
                path + ".input.artifact");
        String excerpt = fields.nonEmptyString(inputNode.get("excerpt"), path + ".input.excerpt");

        return new ReliabilityCorpus.Fixture(id, failureClass, scenario, recoverability,
                new ReliabilityCorpus.Expected(classification, continuationAllowed, confidence),
                new ReliabilityCorpus.Input(stage, artifact, excerpt));
    }

    private ReliabilityCorpus.ExpectedConfidence validateConfidence(FieldChecks fields, JsonNode node, String path,
                                                                   String fixtureId) {
        String prefix = "Reliability corpus fixture \"" + fixtureId + "\" field ";
        if (node == null || !node.isObject()) {
            throw corpusError(prefix + path + " must be an object");
        }
        double scoreMin = unitInterval(node.get("score_min"), prefix + path + ".score_min",
                ReliabilityCorpusException.Code.INVALID_CORPUS);
        double scoreMax = unitInterval(node.get("score_max"), prefix + path + ".score_max",
                ReliabilityCorpusException.Code.INVALID_CORPUS);
        if (scoreMin > scoreMax) {
            throw corpusError(prefix + path + ".score_min must be less than or equal to " + path + ".score_max");
        }
        String band = fields.nonEmptyString(node.get("calibration_band"), path + ".calibration_band");
        try {
            return new ReliabilityCorpus.ExpectedConfidence(scoreMin, scoreMax, CalibrationBand.fromWire(band));
        } catch (IllegalArgumentException e) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.INVALID_CORPUS,
                    prefix + path + ".calibration_band must be one of: " + WireValue.allowed(CalibrationBand.class)
                            + "; received \"" + band + "\"", e);
        }
    }

    // --- thresholds ---

    public ReliabilityThresholds validateThresholds(JsonNode candidate) {
        FieldChecks fields = THRESHOLD_FIELDS;
        fields.object(candidate, "thresholds");

        String schemaVersion = fields.nonEmptyString(candidate.get("schema_version"), "schema_version");
        if (!ReliabilityThresholds.SCHEMA_VERSION.equals(schemaVersion)) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.INVALID_THRESHOLDS,
                    "Reliability threshold schema_version \"" + schemaVersion + "\" is incompatible; expected \""
                            + ReliabilityThresholds.SCHEMA_VERSION + "\"");
        }
        String thresholdId = fields.nonEmptyString(candidate.get("threshold_id"), "threshold_id");
        String corpusSchemaVersion = fields.nonEmptyString(candidate.get("corpus_schema_version"),
                "corpus_schema_version");
        JsonNode metrics = candidate.get("metrics");
        fields.object(metrics, "metrics");

        return new ReliabilityThresholds(schemaVersion, thresholdId, corpusSchemaVersion,
                new ReliabilityThresholds.Metrics(
                        fields.unitInterval(metrics.get("recovery_rate"), "metrics.recovery_rate"),
                        fields.unitInterval(metrics.get("safe_block_rate"), "metrics.safe_block_rate"),
                        fields.unitInterval(metrics.get("safe_allow_rate"), "metrics.safe_allow_rate")));
    }

    /**
     * Checks that the thresholds target this corpus version and that every failure class has
     * both recoverable and non-recoverable fixtures, so no gate rate is computed over nothing.
     */
    public void checkGateCompatibility(ReliabilityCorpus corpus, ReliabilityThresholds thresholds) {
        if (!thresholds.corpusSchemaVersion().equals(corpus.schemaVersion())) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.THRESHOLD_VERSION_MISMATCH,
                    "Reliability thresholds corpus_schema_version \"" + thresholds.corpusSchemaVersion()
                            + "\" does not match corpus schema_version \"" + corpus.schemaVersion() + "\"");
        }

        Map<FailureClass, Set<Recoverability>> coverage = new EnumMap<>(FailureClass.class);
        for (FailureClass failureClass : FailureClass.values()) {
            coverage.put(failureClass, EnumSet.noneOf(Recoverability.class));
        }
        corpus.fixtures().forEach(f -> coverage.get(f.failureClass()).add(f.recoverability()));

        List<String> missing = new ArrayList<>();
        for (FailureClass failureClass : FailureClass.values()) {
            for (Recoverability recoverability : Recoverability.values()) {
                if (!coverage.get(failureClass).contains(recoverability)) {
                    missing.add(failureClass.wireValue() + ":" + recoverability.wireValue());
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.MISSING_COVERAGE,
                    "Reliability corpus missing required recoverability coverage for gate metrics: "
                            + String.join(", ", missing));
        }
    }

    // --- reading ---

    private JsonNode readFile(Path path, String label) {
        Path absolute = path.toAbsolutePath().normalize();
        String source;
        try {
            source = Files.readString(absolute, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.UNREADABLE,
                    "Failed to read " + label + " at " + absolute + ": " + e.getMessage(), e);
        }
        return parse(source, label, absolute.toString());
    }

    private JsonNode readResource(String resource, String label) {
        try (InputStream in = ReliabilityCorpusLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.UNREADABLE,
                        "Failed to read " + label + " at classpath:" + resource + ": resource not found");
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), label, "classpath:" + resource);
        } catch (IOException e) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.UNREADABLE,
                    "Failed to read " + label + " at classpath:" + resource + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode parse(String source, String label, String location) {
        try {
            return CanonicalJson.mapper().readTree(source);
        } catch (JsonProcessingException e) {
            throw new ReliabilityCorpusException(ReliabilityCorpusException.Code.INVALID_JSON,
                    "Failed to parse " + label + " JSON at " + location + ": " + e.getOriginalMessage(), e);
        }
    }

    private static ReliabilityCorpusException corpusError(String message) {
        return new ReliabilityCorpusException(ReliabilityCorpusException.Code.INVALID_CORPUS, message);
    }

    private static double unitInterval(JsonNode value, String subject, ReliabilityCorpusException.Code code) {
        if (value == null || !value.isNumber() || !Double.isFinite(value.asDouble())) {
            throw new ReliabilityCorpusException(code, subject + " must be a finite number");
        }
        double number = value.asDouble();
        if (number < 0 || number > 1) {
            throw new ReliabilityCorpusException(code, subject + " must be within [0, 1]; received " + value);
        }
        return number;
    }

    /** Field assertions whose messages share one prefix and error code. */
    private static final class FieldChecks {

        private final String prefix;
        private final ReliabilityCorpusException.Code code;

        FieldChecks(String prefix, ReliabilityCorpusException.Code code) {
            this.prefix = prefix;
            this.code = code;
        }

        void object(JsonNode value, String path) {
            if (value == null || !value.isObject()) {
                throw fail(path, "must be an object");
            }
        }

        String nonEmptyString(JsonNode value, String path) {
            if (value == null || !value.isTextual() || value.asText().trim().isEmpty()) {
                throw fail(path, "must be a non-empty string");
            }
            return value.asText().trim();
        }

        boolean bool(JsonNode value, String path) {
            if (value == null || !value.isBoolean()) {
                throw fail(path, "must be a boolean");
            }
            return value.asBoolean();
        }

        <E extends Enum<E> & WireValue> E oneOf(Class<E> type, JsonNode value, String path) {
            String literal = nonEmptyString(value, path);
            for (E constant : type.getEnumConstants()) {
                if (constant.wireValue().equals(literal)) {
                    return constant;
                }
            }
            throw fail(path, "must be one of: " + WireValue.allowed(type) + "; received \"" + literal + "\"");
        }

        double unitInterval(JsonNode value, String path) {
            return ReliabilityCorpusLoader.unitInterval(value, prefix + path, code);
        }

        ReliabilityCorpusException fail(String path, String problem) {
            return new ReliabilityCorpusException(code, prefix + path + " " + problem);
        }
    }
}
