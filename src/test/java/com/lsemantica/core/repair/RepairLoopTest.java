package com.lsemantica.core.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.contract.ContractLoader;
import com.lsemantica.core.contract.ContractName;
import com.lsemantica.core.contract.NetworkntSchemaValidator;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.model.FailureClass;
import com.lsemantica.core.trace.GovernanceHooks;
import com.lsemantica.core.trace.NdjsonSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairLoopTest {

    private static final Instant FIXED = Instant.parse("2026-02-22T10:00:00Z");

    private RepairLoop loop;

    @BeforeEach
    void setUp() {
        loop = new RepairLoop(new NdjsonSink());
    }

    private static RepairRequest request(String failureClass, String stage, String artifact, String excerpt) {
        return RepairRequest.parse(failureClass, stage, artifact, excerpt);
    }

    @Nested
    @DisplayName("Rule matching")
    class RuleMatchingTests {

        @Test
        @DisplayName("appends the missing closing quote of a goal declaration")
        void appendsMissingQuote() {
            RepairResult result = loop.run(request("parse", "compile", "ls_source", "goal \"Ship release"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertTrue(result.continuationAllowed());
            assertEquals("PARSE_APPEND_MISSING_QUOTE", result.reasonCode());
            assertEquals("parse.append_missing_goal_quote", result.appliedRuleId());
            assertEquals("goal \"Ship release\"", result.repairedExcerpt());
            assertEquals(1, result.attempts());
            assertEquals(FailureClass.PARSE, result.classification());
        }

        @Test
        @DisplayName("escalates a truncated goal declaration")
        void escalatesTruncatedGoal() {
            RepairResult result = loop.run(request("parse", "compile", "ls_source", "goal \""));

            assertEquals(RepairDecision.ESCALATE, result.decision());
            assertFalse(result.continuationAllowed());
            assertEquals("PARSE_TRUNCATED_CONTEXT", result.reasonCode());
            assertNull(result.repairedExcerpt());
        }

        @Test
        @DisplayName("normalizes a padded schema_version that matches the supported version")
        void normalizesSchemaVersionWhitespace() {
            RepairResult result = loop.run(request("schema_contract", "contract_load", "semantic_ir",
                    "{\"schema_version\": \" 0.1.0 \"}"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertEquals("SCHEMA_VERSION_WHITESPACE_NORMALIZED", result.reasonCode());
            assertEquals("{\"schema_version\": \"0.1.0\"}", result.repairedExcerpt());
        }

        @Test
        @DisplayName("escalates an incompatible schema_version")
        void escalatesIncompatibleVersion() {
            RepairResult result = loop.run(request("schema_contract", "contract_load", "policy_profile",
                    "{\"schema_version\":\"0.2.0\"}"));

            assertEquals(RepairDecision.ESCALATE, result.decision());
            assertEquals("SCHEMA_VERSION_INCOMPATIBLE", result.reasonCode());
            assertEquals("schema_contract.reject_incompatible_schema_version", result.appliedRuleId());
        }

        @Test
        @DisplayName("applies the declared policy fallback plan")
        void appliesFallbackPlan() {
            RepairResult result = loop.run(request("policy_gate", "policy_gate", "policy_profile",
                    "max_tokens exceeded; fallback_plan=summarize_only"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertEquals("POLICY_FALLBACK_PLAN_APPLIED", result.reasonCode());
            assertEquals("max_tokens exceeded; fallback_plan=summarize_only; selected_fallback=summarize_only",
                    result.repairedExcerpt());
        }

        @Test
        @DisplayName("stops on a production destructive-write deny")
        void stopsOnProductionDeny() {
            RepairResult result = loop.run(request("policy_gate", "policy_gate", "policy_profile",
                    "action=delete_resource; environment=production; rule=deny"));

            assertEquals(RepairDecision.STOP, result.decision());
            assertEquals("POLICY_DENY_TERMINAL", result.reasonCode());
        }

        @Test
        @DisplayName("downgrades a denied write to a read-only flow")
        void downgradesToReadOnly() {
            RepairResult result = loop.run(request("capability_denied", "runtime", "capability_manifest",
                    "requested=filesystem.write; available=filesystem.read"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertEquals("requested=filesystem.read; available=filesystem.read", result.repairedExcerpt());
        }

        @Test
        @DisplayName("escalates when no rule matches the payload")
        void escalatesWithoutMatch() {
            RepairResult result = loop.run(request("capability_denied", "runtime", "capability_manifest",
                    "requested=secrets.read; available=filesystem.read"));

            assertEquals(RepairDecision.ESCALATE, result.decision());
            assertEquals("NO_SAFE_DETERMINISTIC_REPAIR", result.reasonCode());
            assertEquals(1, result.attempts());
            assertTrue(result.history().isEmpty());
            assertNull(result.appliedRuleId());
        }

        @Test
        @DisplayName("rules are scoped to their stage and artifact")
        void stageScoped() {
            RepairResult result = loop.run(request("parse", "runtime", "ls_source", "goal \"Ship release"));

            assertEquals("NO_SAFE_DETERMINISTIC_REPAIR", result.reasonCode());
        }
    }

    @Nested
    @DisplayName("Retry budget")
    class RetryBudgetTests {

        @Test
        @DisplayName("timeout retries once then recovers on the second attempt")
        void timeoutRecovers() {
            RepairResult result = loop.run(request("deterministic_runtime", "runtime", "runtime_event",
                    "error=timeout; retryable=true"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertEquals("DETERMINISTIC_TIMEOUT_RECOVERED", result.reasonCode());
            assertEquals(2, result.attempts());
            assertEquals("error=none; retryable=false", result.repairedExcerpt());

            List<RepairAttempt> history = result.history();
            assertEquals(2, history.size());
            assertEquals(AttemptOutcome.RETRY, history.get(0).outcome());
            assertEquals("DETERMINISTIC_TIMEOUT_RETRY", history.get(0).reasonCode());
            assertEquals(AttemptOutcome.REPAIRED, history.get(1).outcome());
        }

        @Test
        @DisplayName("a single-attempt budget stops a retryable failure")
        void singleAttemptStops() {
            RepairResult result = loop.run(request("deterministic_runtime", "runtime", "runtime_event",
                    "error=timeout; retryable=true"), RepairOptions.defaults().withMaxAttempts(1));

            assertEquals(RepairDecision.STOP, result.decision());
            assertEquals("MAX_ATTEMPTS_EXCEEDED", result.reasonCode());
            assertEquals("Maximum retry attempts reached (1) after DETERMINISTIC_TIMEOUT_RETRY.", result.detail());
            assertEquals("deterministic_runtime.retry_timeout_then_recover", result.appliedRuleId());
        }

        @Test
        @DisplayName("low confidence is raised to the threshold literal after a re-prompt")
        void confidenceRaised() {
            RepairResult result = loop.run(request("stochastic_extraction_uncertainty", "extraction", "model_output",
                    "entity=release_owner; confidence=0.62; threshold=0.8"));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertEquals("STOCHASTIC_CONFIDENCE_RECOVERED", result.reasonCode());
            assertEquals("entity=release_owner; confidence=0.8; threshold=0.8", result.repairedExcerpt());
        }

        @Test
        @DisplayName("unresolved ambiguity exhausts the budget")
        void ambiguityExhausts() {
            RepairResult result = loop.run(request("stochastic_extraction_uncertainty", "extraction", "model_output",
                    "top_candidates overlap; confidence delta < 0.02"));

            assertEquals(RepairDecision.STOP, result.decision());
            assertEquals("MAX_ATTEMPTS_EXCEEDED", result.reasonCode());
            assertEquals(2, result.attempts());
            assertEquals(2, result.history().size());
        }

        @Test
        @DisplayName("attempt budget must be within [1, 10]")
        void budgetBounds() {
            RepairRequest request = request("parse", "compile", "ls_source", "goal \"x");

            var low = assertThrows(RepairInputException.class,
                    () -> loop.run(request, RepairOptions.defaults().withMaxAttempts(0)));
            assertEquals(RepairInputException.Code.INVALID_MAX_ATTEMPTS, low.code());

            var high = assertThrows(RepairInputException.class,
                    () -> loop.run(request, RepairOptions.defaults().withMaxAttempts(11)));
            assertEquals(RepairInputException.Code.INVALID_MAX_ATTEMPTS, high.code());

            assertEquals(10, loop.run(request, RepairOptions.defaults().withMaxAttempts(10)).maxAttempts());
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(FailureClass.class)
        @DisplayName("a zero attempt budget is rejected for every failure class")
        void zeroBudgetRejectedForEveryClass(FailureClass failureClass) {
            RepairRequest request = new RepairRequest(failureClass, RepairStage.RUNTIME, RepairArtifact.RUNTIME_EVENT,
                    "step=resolve_manifest; error=timeout; retryable=true");

            var ex = assertThrows(RepairInputException.class,
                    () -> loop.run(request, RepairOptions.defaults().withMaxAttempts(0)));
            assertEquals(RepairInputException.Code.INVALID_MAX_ATTEMPTS, ex.code());
            assertEquals("maxAttempts must be an integer greater than or equal to 1", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class InputTests {

        @Test
        @DisplayName("unknown failure class is rejected")
        void unknownClass() {
            var ex = assertThrows(RepairInputException.class,
                    () -> request("gremlins", "compile", "ls_source", "goal \"x"));
            assertEquals(RepairInputException.Code.INVALID_INPUT, ex.code());
        }

        @Test
        @DisplayName("blank excerpt is rejected")
        void blankExcerpt() {
            assertThrows(RepairInputException.class, () -> request("parse", "compile", "ls_source", "   "));
        }

        @Test
        @DisplayName("null request is rejected")
        void nullRequest() {
            assertThrows(RepairInputException.class, () -> loop.run(null));
        }

        @Test
        @DisplayName("target joins stage and artifact")
        void target() {
            assertEquals("compile.ls_source", request("parse", "compile", "ls_source", "goal \"x").target());
        }
    }

    @Nested
    @DisplayName("Trace emission")
    class EmissionTests {

        @TempDir
        Path tempDir;

        private RepairOptions emittingOptions(Path feedback) {
            return RepairOptions.defaults()
                    .withFeedbackTensorPath(feedback)
                    .withHooks(GovernanceHooks.fixed(FIXED, "run-repair-1").withFeedbackIdFactory(() -> "ft-1"));
        }

        @Test
        @DisplayName("emits one schema-valid FeedbackTensor line per run")
        void emitsFeedbackTensor() throws IOException {
            Path feedback = tempDir.resolve("feedback.ndjson");

            loop.run(request("parse", "compile", "ls_source", "goal \"Ship release"), emittingOptions(feedback));

            List<String> lines = Files.readAllLines(feedback);
            assertEquals(1, lines.size());
            JsonNode tensor = CanonicalJson.readTree(lines.get(0));
            assertEquals("ft-1", tensor.get("feedback_id").asText());
            assertEquals("2026-02-22T10:00:00.000Z", tensor.get("generated_at").asText());
            assertEquals("parse", tensor.at("/failure_signal/class").asText());
            assertEquals("repair", tensor.at("/failure_signal/stage").asText());
            assertEquals("retry_with_patch", tensor.at("/proposed_repair_action/action").asText());
            assertEquals("compile.ls_source", tensor.at("/proposed_repair_action/target").asText());
            assertEquals("run-repair-1", tensor.at("/provenance/run_id").asText());
            assertEquals("repair_loop", tensor.at("/provenance/source_stage").asText());

            ContractLoader loader = new ContractLoader(new NetworkntSchemaValidator());
            assertDoesNotThrow(() -> loader.validate(ContractName.FEEDBACK_TENSOR, tensor));
        }

        @Test
        @DisplayName("escalation proposes manual review with human approval")
        void escalationTensor() throws IOException {
            Path feedback = tempDir.resolve("feedback.ndjson");

            loop.run(request("parse", "compile", "ls_source", "goal \""), emittingOptions(feedback));

            JsonNode tensor = CanonicalJson.readTree(Files.readAllLines(feedback).get(0));
            assertEquals("request_manual_review", tensor.at("/proposed_repair_action/action").asText());
            assertTrue(tensor.at("/proposed_repair_action/requires_human_approval").asBoolean());
            assertFalse(tensor.at("/failure_signal/continuation_allowed").asBoolean());
            assertEquals("medium", tensor.at("/confidence/calibration_band").asText());
        }

        @Test
        @DisplayName("writes the inspection entry and text report")
        void writesInspection() throws IOException {
            Path entries = tempDir.resolve("inspection.ndjson");
            Path report = tempDir.resolve("inspection.txt");

            loop.run(request("deterministic_runtime", "runtime", "runtime_event", "error=timeout; retryable=true"),
                    RepairOptions.defaults()
                            .withTraceInspection(entries, report)
                            .withHooks(GovernanceHooks.fixed(FIXED, "run-repair-2")));

            JsonNode entry = CanonicalJson.readTree(Files.readAllLines(entries).get(0));
            assertEquals("run-repair-2", entry.get("run_id").asText());
            assertEquals("repaired", entry.at("/repair/decision").asText());

            String text = Files.readString(report);
            assertTrue(text.startsWith("[Trace Inspection]"));
            assertTrue(text.contains("Run ID: run-repair-2"));
            assertTrue(text.contains("Repair Attempts: 2/2"));
            assertTrue(text.contains("FeedbackTensor Configured: no"));
        }

        @Test
        @DisplayName("an unwritable sink does not change the decision")
        void sinkFailureIgnored() {
            Path feedback = tempDir.resolve("missing-dir").resolve("feedback.ndjson");

            RepairResult result = loop.run(request("parse", "compile", "ls_source", "goal \"Ship release"),
                    emittingOptions(feedback));

            assertEquals(RepairDecision.REPAIRED, result.decision());
            assertFalse(Files.exists(feedback));
        }
    }
}
