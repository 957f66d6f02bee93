package com.lsemantica.core.lsdoc;

import java.util.List;

/**
 * A parsed {@code .ls} declaration document: one goal, then capabilities, then checks.
 */
public record LsDocument(Goal goal, List<Declaration> capabilities, List<Declaration> checks, SourceRange range) {

    public LsDocument {
        capabilities = List.copyOf(capabilities);
        checks = List.copyOf(checks);
    }

    public record Goal(String value, SourceRange range) {}

    public record Declaration(String name, String description, SourceRange range) {}
}
