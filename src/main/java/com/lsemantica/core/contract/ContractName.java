package com.lsemantica.core.contract;

/**
 * Versioned contracts known to the loader, with the exact schema version each one accepts.
 */
public enum ContractName {
    SEMANTIC_IR("SemanticIR", "0.1.0", "semanticir-v0.schema.json"),
    POLICY_PROFILE("PolicyProfile", "0.1.0", "policyprofile-v0.schema.json"),
    VERIFICATION_CONTRACT("VerificationContract", "0.1.0", "verificationcontract-v0.schema.json"),
    FEEDBACK_TENSOR("FeedbackTensor", "1.0.0", "feedbacktensor-v1.schema.json"),
    RUNTIME_CONTRACTS("RuntimeContracts", null, null);

    private final String displayName;
    private final String supportedVersion;
    private final String schemaResource;

    ContractName(String displayName, String supportedVersion, String schemaResource) {
        this.displayName = displayName;
        this.supportedVersion = supportedVersion;
        this.schemaResource = schemaResource;
    }

    public String displayName() {
        return displayName;
    }

    public String supportedVersion() {
        return supportedVersion;
    }

    /** Classpath location of the JSON Schema, or {@code null} for the runtime envelope. */
    public String schemaResource() {
        return schemaResource == null ? null : "/schemas/" + schemaResource;
    }

    public static ContractName fromDisplayName(String value) {
        for (ContractName name : values()) {
            if (name.displayName.equalsIgnoreCase(value) || name.name().equalsIgnoreCase(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown contract \"" + value + "\"");
    }
}
