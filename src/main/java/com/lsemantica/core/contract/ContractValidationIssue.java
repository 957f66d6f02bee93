package com.lsemantica.core.contract;

/**
 * One schema or semantic violation.
 *
 * @param instancePath JSON pointer of the offending value, {@code ""} for the document root
 * @param keyword      schema keyword that failed, e.g. {@code required} or {@code const}
 * @param message      human-readable description
 */
public record ContractValidationIssue(String instancePath, String keyword, String message) {

    public String displayPath() {
        return instancePath == null || instancePath.isEmpty() ? "/" : instancePath;
    }
}
