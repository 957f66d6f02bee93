package com.lsemantica.core.lsdoc;

public record LsDiagnostic(Code code, String message, SourceRange range) {

    public enum Code {
        LEX_UNEXPECTED_CHARACTER,
        LEX_UNTERMINATED_STRING,
        LEX_INVALID_ESCAPE,
        PARSE_EXPECTED_DECLARATION,
        PARSE_EXPECTED_TOKEN,
        PARSE_UNEXPECTED_TOKEN,
        PARSE_MISSING_REQUIRED_DECLARATION
    }
}
