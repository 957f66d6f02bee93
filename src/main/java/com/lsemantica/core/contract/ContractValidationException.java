package com.lsemantica.core.contract;

import java.util.List;

/**
 * Thrown when a contract document is not an object, declares an unsupported version or fails
 * schema validation. Carries every collected issue.
 */
public class ContractValidationException extends RuntimeException {

    private final ContractName contract;
    private final ContractValidationCode code;
    private final List<ContractValidationIssue> issues;

    public ContractValidationException(ContractName contract, ContractValidationCode code, String message,
                                       List<ContractValidationIssue> issues) {
        super(message);
        this.contract = contract;
        this.code = code;
        this.issues = List.copyOf(issues);
    }

    public ContractName contract() {
        return contract;
    }

    public ContractValidationCode code() {
        return code;
    }

    public List<ContractValidationIssue> issues() {
        return issues;
    }
}
