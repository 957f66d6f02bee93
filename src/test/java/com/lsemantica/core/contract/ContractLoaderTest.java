package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.model.Decision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

class ContractLoaderTest {

    private ContractLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ContractLoader(new NetworkntSchemaValidator());
    }

    static ObjectNode example(String name) {
        try (InputStream in = ContractLoaderTest.class.getResourceAsStream("/examples/" + name)) {
            assertNotNull(in, "missing example " + name);
            return (ObjectNode) CanonicalJson.mapper().readTree(in);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Nested
    @DisplayName("SemanticIR")
    class SemanticIrTests {

        @Test
        @DisplayName("canonical example loads into a typed contract")
        void loadsCanonicalExample() {
            SemanticIrContract ir = loader.loadSemanticIr(example("semanticir.canonical.v0.json"));

            assertEquals("0.1.0", ir.schemaVersion());
            assertEquals("ir-release-notes-001", ir.irId());
            assertEquals("Ship release notes for v0.1.0", ir.goal());
            assertEquals(2, ir.deterministicNodeCount());
            assertEquals(1, ir.stochasticNodeCount());
        }

        @Test
        @DisplayName("missing goal fails schema validation with a required issue")
        void missingGoalFails() {
            var ex = assertThrows(ContractValidationException.class,
                    () -> loader.loadSemanticIr(example("semanticir.invalid.missing-goal.json")));

            assertEquals(ContractValidationCode.SCHEMA_VALIDATION_FAILED, ex.code());
            assertEquals(ContractName.SEMANTIC_IR, ex.contract());
            assertTrue(ex.issues().stream().anyMatch(issue ->
                    "required".equals(issue.keyword()) && issue.message().contains("goal")));
            assertTrue(ex.getMessage().startsWith("SemanticIR contract validation failed at "));
        }

        @Test
        @DisplayName("unknown top-level field is rejected")
        void unknownFieldRejected() {
            ObjectNode ir = example("semanticir.canonical.v0.json");
            ir.put("extra", true);

            var ex = assertThrows(ContractValidationException.class, () -> loader.loadSemanticIr(ir));
            assertEquals(ContractValidationCode.SCHEMA_VALIDATION_FAILED, ex.code());
        }

        @Test
        @DisplayName("non-object input is INVALID_INPUT")
        void nonObjectInput() {
            JsonNode array = CanonicalJson.readTree("[1, 2]");

            var ex = assertThrows(ContractValidationException.class, () -> loader.loadSemanticIr(array));
            assertEquals(ContractValidationCode.INVALID_INPUT, ex.code());
            assertTrue(ex.issues().isEmpty());

            var nullEx = assertThrows(ContractValidationException.class, () -> loader.loadSemanticIr(null));
            assertEquals(ContractValidationCode.INVALID_INPUT, nullEx.code());
        }
    }

    @Nested
    @DisplayName("Version checks")
    class VersionTests {

        @Test
        @DisplayName("unsupported schema_version is VERSION_INCOMPATIBLE before schema validation")
        void incompatibleVersion() {
            var ex = assertThrows(ContractValidationException.class,
                    () -> loader.loadPolicyProfile(example("policyprofile.invalid.version.json")));

            assertEquals(ContractValidationCode.VERSION_INCOMPATIBLE, ex.code());
            assertEquals("PolicyProfile schema_version \"0.2.0\" is incompatible; expected \"0.1.0\"",
                    ex.getMessage());
            assertEquals("/schema_version", ex.issues().get(0).instancePath());
        }

        @Test
        @DisplayName("whitespace around the version is not tolerated")
        void paddedVersionRejected() {
            ObjectNode ir = example("semanticir.canonical.v0.json");
            ir.put("schema_version", " 0.1.0 ");

            var ex = assertThrows(ContractValidationException.class, () -> loader.loadSemanticIr(ir));
            assertEquals(ContractValidationCode.VERSION_INCOMPATIBLE, ex.code());
        }

        @Test
        @DisplayName("missing schema_version is a schema failure")
        void missingVersion() {
            ObjectNode ir = example("semanticir.canonical.v0.json");
            ir.remove("schema_version");

            var ex = assertThrows(ContractValidationException.class, () -> loader.loadSemanticIr(ir));
            assertEquals(ContractValidationCode.SCHEMA_VALIDATION_FAILED, ex.code());
            assertEquals("SemanticIR schema_version is required", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("PolicyProfile")
    class PolicyProfileTests {

        @Test
        @DisplayName("resolves dotted paths into the document")
        void resolvesDottedPath() {
            PolicyProfileContract profile = loader.loadPolicyProfile(example("policyprofile.production.v0.json"));

            assertEquals("production", profile.environment());
            assertTrue(profile.resolvePath("constraints.require_human_review_on_policy_violation")
                    .orElseThrow().asBoolean());
            assertEquals("filesystem.write", profile
                    .resolvePath("capability_policy.escalation_requirements.rules.0.capability")
                    .orElseThrow().asText());
            assertTrue(profile.resolvePath("constraints.missing").isEmpty());
            assertTrue(profile.resolvePath("").isEmpty());
        }

        @Test
        @DisplayName("manual_approval default requires at least one rule")
        void manualApprovalNeedsRules() {
            ObjectNode profile = example("policyprofile.production.v0.json");
            ((ObjectNode) profile.path("capability_policy").path("escalation_requirements"))
                    .putArray("rules");

            assertThrows(ContractValidationException.class, () -> loader.loadPolicyProfile(profile));
        }
    }

    @Nested
    @DisplayName("VerificationContract")
    class VerificationContractTests {

        @Test
        @DisplayName("example loads with typed requirements and continuation")
        void loadsExample() {
            VerificationContract contract = loader.loadVerificationContract(example("verificationcontract.v0.json"));

            assertEquals("verification-release-notes-001", contract.contractId());
            assertEquals(2, contract.tests().size());
            assertEquals(1, contract.staticAnalysis().size());
            assertEquals(1, contract.policyAssertions().size());
            assertEquals(Decision.CONTINUE, contract.continuation().onSuccess());
            assertEquals(Decision.STOP, contract.continuation().onFailure());
            assertTrue(contract.continuation().requirePolicyProfile());
            assertEquals(2, contract.passCriteria().maxWarningCount());
        }

        @Test
        @DisplayName("duplicate requirement ids are rejected")
        void duplicateIdsRejected() {
            ObjectNode contract = example("verificationcontract.v0.json");
            ((ObjectNode) contract.path("requirements").path("tests").get(1)).put("id", "unit");

            var ex = assertThrows(ContractValidationException.class,
                    () -> loader.loadVerificationContract(contract));
            assertEquals("/requirements/tests/1/id", ex.issues().get(0).instancePath());
            assertEquals("uniqueId", ex.issues().get(0).keyword());
        }
    }

    @Nested
    @DisplayName("Runtime envelope")
    class RuntimeEnvelopeTests {

        @Test
        @DisplayName("loads all three contracts")
        void loadsEnvelope() {
            RuntimeContracts contracts = loader.loadRuntimeContracts(example("runtime-contracts.v0.json"));

            assertEquals("ir-release-notes-001", contracts.semanticIr().irId());
            assertEquals("policy-production-001", contracts.policyProfile().profileId());
            assertTrue(contracts.hasVerificationContract());
        }

        @Test
        @DisplayName("verification contract is optional")
        void verificationOptional() {
            ObjectNode envelope = example("runtime-contracts.v0.json");
            envelope.remove("verificationContract");

            RuntimeContracts contracts = loader.loadRuntimeContracts(envelope);
            assertFalse(contracts.hasVerificationContract());
        }

        @Test
        @DisplayName("validate dispatches by contract name")
        void validateByName() {
            assertDoesNotThrow(() -> loader.validate(ContractName.fromDisplayName("runtimecontracts"),
                    example("runtime-contracts.v0.json")));
            assertThrows(IllegalArgumentException.class, () -> ContractName.fromDisplayName("Nope"));
        }
    }
}
