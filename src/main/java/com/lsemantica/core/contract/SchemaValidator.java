package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON-Schema validation seam. Implementations collect every violation rather than failing
 * on the first one.
 */
public interface SchemaValidator {

    /**
     * @return the violations, ordered by instance path; empty when the document is valid
     */
    List<ContractValidationIssue> validate(ContractName contract, JsonNode document);
}
