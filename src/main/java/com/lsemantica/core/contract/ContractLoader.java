package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads versioned contracts. Each document must be a JSON object, declare exactly the
 * supported {@code schema_version} and satisfy its JSON Schema; only then is the typed
 * record built.
 */
@Service
public class ContractLoader {

    private static final Logger log = LoggerFactory.getLogger(ContractLoader.class);

    private final SchemaValidator schemaValidator;

    public ContractLoader(SchemaValidator schemaValidator) {
        this.schemaValidator = schemaValidator;
    }

    public SemanticIrContract loadSemanticIr(JsonNode input) {
        JsonNode document = checkContract(ContractName.SEMANTIC_IR, input);
        return new SemanticIrContract(
                document.get("schema_version").asText(),
                document.path("metadata").path("ir_id").asText(),
                document.path("goal").asText(),
                document);
    }

    public PolicyProfileContract loadPolicyProfile(JsonNode input) {
        JsonNode document = checkContract(ContractName.POLICY_PROFILE, input);
        JsonNode metadata = document.path("metadata");
        return new PolicyProfileContract(
                document.get("schema_version").asText(),
                metadata.path("profile_id").asText(),
                metadata.path("environment").asText(),
                document);
    }

    public VerificationContract loadVerificationContract(JsonNode input) {
        JsonNode document = checkContract(ContractName.VERIFICATION_CONTRACT, input);
        JsonNode requirements = document.path("requirements");

        List<ContractValidationIssue> issues = new ArrayList<>();
        List<VerificationContract.CheckRequirement> tests =
                readChecks(requirements.path("tests"), "/requirements/tests", issues);
        List<VerificationContract.CheckRequirement> staticAnalysis =
                readChecks(requirements.path("static_analysis"), "/requirements/static_analysis", issues);
        List<VerificationContract.PolicyAssertion> assertions =
                readAssertions(requirements.path("policy_assertions"), issues);
        if (!issues.isEmpty()) {
            throw schemaFailure(ContractName.VERIFICATION_CONTRACT, issues);
        }

        JsonNode criteria = document.path("pass_criteria");
        JsonNode continuation = document.path("continuation");
        List<String> requiredFields = new ArrayList<>();
        continuation.path("required_feedback_tensor_fields").forEach(field -> requiredFields.add(field.asText()));

        return new VerificationContract(
                document.get("schema_version").asText(),
                document.path("metadata").path("contract_id").asText(),
                tests,
                staticAnalysis,
                assertions,
                new VerificationContract.PassCriteria(
                        criteria.path("minimum_required_checks_pass_ratio").asDouble(),
                        criteria.path("max_warning_count").asInt(),
                        criteria.path("require_all_policy_assertions").asBoolean()),
                new VerificationContract.Continuation(
                        Decision.fromWire(continuation.path("on_success").asText()),
                        Decision.fromWire(continuation.path("on_failure").asText()),
                        continuation.path("require_policy_profile").asBoolean(),
                        requiredFields),
                document);
    }

    /**
     * Loads the runtime envelope {@code {semanticIr, policyProfile, verificationContract?}}.
     */
    public RuntimeContracts loadRuntimeContracts(JsonNode input) {
        requireObject(ContractName.RUNTIME_CONTRACTS, input);
        SemanticIrContract semanticIr = loadSemanticIr(input.get("semanticIr"));
        PolicyProfileContract policyProfile = loadPolicyProfile(input.get("policyProfile"));
        JsonNode verification = input.get("verificationContract");
        VerificationContract verificationContract =
                verification == null || verification.isNull() ? null : loadVerificationContract(verification);
        log.debug("Loaded runtime contracts ir={} profile={} verification={}",
                semanticIr.irId(), policyProfile.profileId(),
                verificationContract == null ? "none" : verificationContract.contractId());
        return new RuntimeContracts(semanticIr, policyProfile, verificationContract);
    }

    /**
     * Validates a document without building the typed record. Used by the {@code validate}
     * command, which also accepts FeedbackTensor records.
     */
    public void validate(ContractName contract, JsonNode input) {
        switch (contract) {
            case SEMANTIC_IR -> loadSemanticIr(input);
            case POLICY_PROFILE -> loadPolicyProfile(input);
            case VERIFICATION_CONTRACT -> loadVerificationContract(input);
            case FEEDBACK_TENSOR -> checkContract(contract, input);
            case RUNTIME_CONTRACTS -> loadRuntimeContracts(input);
        }
    }

    private JsonNode checkContract(ContractName contract, JsonNode input) {
        requireObject(contract, input);
        requireCompatibleVersion(contract, input);
        List<ContractValidationIssue> issues = schemaValidator.validate(contract, input);
        if (!issues.isEmpty()) {
            throw schemaFailure(contract, issues);
        }
        return input.deepCopy();
    }

    private static void requireObject(ContractName contract, JsonNode input) {
        if (input == null || !input.isObject()) {
            throw new ContractValidationException(contract, ContractValidationCode.INVALID_INPUT,
                    contract.displayName() + " contract input must be an object", List.of());
        }
    }

    private static void requireCompatibleVersion(ContractName contract, JsonNode input) {
        JsonNode version = input.get("schema_version");
        if (version == null || !version.isTextual() || version.asText().trim().isEmpty()) {
            throw new ContractValidationException(contract, ContractValidationCode.SCHEMA_VALIDATION_FAILED,
                    contract.displayName() + " schema_version is required",
                    List.of(new ContractValidationIssue("/schema_version", "required", "schema_version is required")));
        }
        String expected = contract.supportedVersion();
        if (!version.asText().equals(expected)) {
            throw new ContractValidationException(contract, ContractValidationCode.VERSION_INCOMPATIBLE,
                    contract.displayName() + " schema_version \"" + version.asText()
                            + "\" is incompatible; expected \"" + expected + "\"",
                    List.of(new ContractValidationIssue("/schema_version", "const",
                            "expected \"" + expected + "\"")));
        }
    }

    private static ContractValidationException schemaFailure(ContractName contract,
                                                             List<ContractValidationIssue> issues) {
        ContractValidationIssue first = issues.get(0);
        return new ContractValidationException(contract, ContractValidationCode.SCHEMA_VALIDATION_FAILED,
                contract.displayName() + " contract validation failed at " + first.displayPath()
                        + ": " + first.message(),
                issues);
    }

    private static List<VerificationContract.CheckRequirement> readChecks(JsonNode array, String pointer,
                                                                         List<ContractValidationIssue> issues) {
        List<VerificationContract.CheckRequirement> checks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode entry = array.get(i);
            String id = entry.path("id").asText();
            if (!seen.add(id)) {
                issues.add(new ContractValidationIssue(pointer + "/" + i + "/id", "uniqueId",
                        "duplicate requirement id \"" + id + "\""));
            }
            checks.add(new VerificationContract.CheckRequirement(id, entry.path("required").asBoolean()));
        }
        return checks;
    }

    private static List<VerificationContract.PolicyAssertion> readAssertions(JsonNode array,
                                                                            List<ContractValidationIssue> issues) {
        List<VerificationContract.PolicyAssertion> assertions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode entry = array.get(i);
            String id = entry.path("id").asText();
            if (!seen.add(id)) {
                issues.add(new ContractValidationIssue("/requirements/policy_assertions/" + i + "/id", "uniqueId",
                        "duplicate policy assertion id \"" + id + "\""));
            }
            assertions.add(new VerificationContract.PolicyAssertion(
                    id,
                    entry.path("policy_path").asText(),
                    entry.get("expected").deepCopy(),
                    entry.path("required").asBoolean()));
        }
        return assertions;
    }
}
