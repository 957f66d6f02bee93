package com.lsemantica.core.lsdoc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the {@code .ls} declaration language:
 * <pre>
 * goal "Ship release"
 * capability deploy "Deploys the build"
 * check smoke "Runs smoke tests"
 * </pre>
 * Exactly one goal comes first, followed by at least one capability and then at least one
 * check. Strings support the escapes {@code \\ \" \n \t}. Any diagnostic means no document
 * is produced.
 */
public final class LsDocumentReader {

    private LsDocumentReader() {}

    public record Result(LsDocument document, List<LsDiagnostic> diagnostics) {

        public Result {
            diagnostics = List.copyOf(diagnostics);
        }

        public Optional<LsDocument> documentIfValid() {
            return Optional.ofNullable(document);
        }
    }

    public static Result read(String source) {
        Lexer lexer = new Lexer(source == null ? "" : source);
        List<Token> tokens = lexer.tokenize();
        if (!lexer.diagnostics.isEmpty()) {
            return new Result(null, lexer.diagnostics);
        }
        return new Parser(tokens).parse();
    }

    enum Kind { GOAL, CAPABILITY, CHECK, IDENTIFIER, STRING, NEWLINE, EOF }

    record Token(Kind kind, String value, SourceRange range) {}

    private static final Map<String, Kind> KEYWORDS = Map.of(
            "goal", Kind.GOAL,
            "capability", Kind.CAPABILITY,
            "check", Kind.CHECK);

    private static final class Lexer {

        private final String source;
        private final List<Token> tokens = new ArrayList<>();
        private final List<LsDiagnostic> diagnostics = new ArrayList<>();
        private int index;
        private int line = 1;
        private int column = 1;

        Lexer(String source) {
            this.source = source;
        }

        List<Token> tokenize() {
            while (index < source.length()) {
                char c = source.charAt(index);
                if (c == ' ' || c == '\t') {
                    advance();
                } else if (c == '\n') {
                    SourceRange.Position start = position();
                    advance();
                    tokens.add(new Token(Kind.NEWLINE, "\n", SourceRange.between(start, position())));
                } else if (c == '\r' && peek(1) == '\n') {
                    SourceRange.Position start = position();
                    advance();
                    advance();
                    tokens.add(new Token(Kind.NEWLINE, "\r\n", SourceRange.between(start, position())));
                } else if (c == '"') {
                    readString();
                } else if (isLetter(c)) {
                    SourceRange.Position start = position();
                    StringBuilder word = new StringBuilder();
                    while (index < source.length() && isIdentifierPart(source.charAt(index))) {
                        word.append(advance());
                    }
                    String text = word.toString();
                    tokens.add(new Token(KEYWORDS.getOrDefault(text, Kind.IDENTIFIER), text,
                            SourceRange.between(start, position())));
                } else {
                    SourceRange.Position start = position();
                    char unexpected = advance();
                    diagnostics.add(new LsDiagnostic(LsDiagnostic.Code.LEX_UNEXPECTED_CHARACTER,
                            "Unexpected character \"" + unexpected + "\"", SourceRange.between(start, position())));
                }
            }
            tokens.add(new Token(Kind.EOF, "", SourceRange.at(position())));
            return tokens;
        }

        private void readString() {
            SourceRange.Position start = position();
            StringBuilder value = new StringBuilder();
            advance();
            boolean terminated = false;
            while (index < source.length()) {
                char c = source.charAt(index);
                if (c == '"') {
                    advance();
                    terminated = true;
                    break;
                }
                if (c == '\n' || c == '\r') {
                    break;
                }
                if (c == '\\') {
                    advance();
                    if (index >= source.length()) {
                        break;
                    }
                    char escaped = advance();
                    switch (escaped) {
                        case '\\' -> value.append('\\');
                        case '"' -> value.append('"');
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        default -> diagnostics.add(new LsDiagnostic(LsDiagnostic.Code.LEX_INVALID_ESCAPE,
                                "Invalid string escape sequence \"\\" + escaped + "\"",
                                SourceRange.between(start, position())));
                    }
                    continue;
                }
                value.append(advance());
            }
            if (terminated) {
                tokens.add(new Token(Kind.STRING, value.toString(), SourceRange.between(start, position())));
            } else {
                diagnostics.add(new LsDiagnostic(LsDiagnostic.Code.LEX_UNTERMINATED_STRING,
                        "Unterminated string literal", SourceRange.between(start, position())));
            }
        }

        private SourceRange.Position position() {
            return new SourceRange.Position(index, line, column);
        }

        private char peek(int ahead) {
            int at = index + ahead;
            return at < source.length() ? source.charAt(at) : '\0';
        }

        private char advance() {
            char c = source.charAt(index++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private static boolean isLetter(char c) {
            return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
        }

        private static boolean isIdentifierPart(char c) {
            return isLetter(c) || (c >= '0' && c <= '9') || c == '_' || c == '-';
        }
    }

    private static final class Parser {

        private final List<Token> tokens;
        private final List<LsDiagnostic> diagnostics = new ArrayList<>();
        private int index;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Result parse() {
            skipNewlines();
            Token first = current();
            LsDocument.Goal goal = null;
            if (first.kind() == Kind.GOAL) {
                goal = parseGoal();
            } else {
                diagnostic(LsDiagnostic.Code.PARSE_EXPECTED_DECLARATION,
                        "Document must start with a goal declaration", first.range());
            }

            List<LsDocument.Declaration> capabilities = new ArrayList<>();
            List<LsDocument.Declaration> checks = new ArrayList<>();
            boolean inChecks = false;
            while (!at(Kind.EOF)) {
                skipNewlines();
                Token token = current();
                if (token.kind() == Kind.EOF) {
                    break;
                }
                int startIndex = index;
                if (token.kind() == Kind.CHECK) {
                    inChecks = true;
                    parseDeclaration(Kind.CHECK, "check").ifPresent(checks::add);
                } else if (token.kind() == Kind.CAPABILITY && !inChecks) {
                    parseDeclaration(Kind.CAPABILITY, "capability").ifPresent(capabilities::add);
                } else if (token.kind() == Kind.CAPABILITY) {
                    unexpected("Capability declarations are not allowed after check declarations begin", token);
                } else if (token.kind() == Kind.GOAL) {
                    unexpected(inChecks
                            ? "Unexpected 'goal' declaration after check declarations"
                            : "Unexpected 'goal' declaration: only one goal declaration is allowed", token);
                } else {
                    diagnostic(LsDiagnostic.Code.PARSE_EXPECTED_DECLARATION, inChecks
                            ? "Expected a check declaration"
                            : "Expected a capability declaration after the goal declaration", token.range());
                    skipLine();
                }
                if (index == startIndex) {
                    skipLine();
                }
            }

            if (goal == null && diagnostics.isEmpty()) {
                diagnostic(LsDiagnostic.Code.PARSE_MISSING_REQUIRED_DECLARATION,
                        "Document must contain exactly one goal declaration", first.range());
            }
            if (capabilities.isEmpty()) {
                diagnostic(LsDiagnostic.Code.PARSE_MISSING_REQUIRED_DECLARATION,
                        "Document must contain at least one capability declaration",
                        SourceRange.at(goal != null ? goal.range().end() : first.range().start()));
            }
            if (checks.isEmpty()) {
                SourceRange.Position anchor = !capabilities.isEmpty()
                        ? capabilities.get(capabilities.size() - 1).range().end()
                        : goal != null ? goal.range().end() : first.range().start();
                diagnostic(LsDiagnostic.Code.PARSE_MISSING_REQUIRED_DECLARATION,
                        "Document must contain at least one check declaration", SourceRange.at(anchor));
            }

            if (!diagnostics.isEmpty()) {
                return new Result(null, diagnostics);
            }
            SourceRange range = SourceRange.between(goal.range().start(), checks.get(checks.size() - 1).range().end());
            return new Result(new LsDocument(goal, capabilities, checks, range), diagnostics);
        }

        private LsDocument.Goal parseGoal() {
            Token keyword = advance();
            Token value = expect(Kind.STRING, "Expected a quoted string after 'goal'");
            if (value == null) {
                skipToLineEnd();
                return null;
            }
            requireLineEnd("goal declaration");
            return new LsDocument.Goal(value.value(), SourceRange.between(keyword.range().start(), value.range().end()));
        }

        private Optional<LsDocument.Declaration> parseDeclaration(Kind kind, String label) {
            Token keyword = advance();
            Token name = expect(Kind.IDENTIFIER, "Expected " + label + " identifier after '" + label + "'");
            if (name == null) {
                skipToLineEnd();
                return Optional.empty();
            }
            Token description = expect(Kind.STRING, "Expected a quoted string after " + label + " identifier");
            if (description == null) {
                skipToLineEnd();
                return Optional.empty();
            }
            requireLineEnd(label + " declaration");
            return Optional.of(new LsDocument.Declaration(name.value(), description.value(),
                    SourceRange.between(keyword.range().start(), description.range().end())));
        }

        private Token expect(Kind kind, String message) {
            if (at(kind)) {
                return advance();
            }
            diagnostic(LsDiagnostic.Code.PARSE_EXPECTED_TOKEN, message, current().range());
            return null;
        }

        private void requireLineEnd(String context) {
            if (at(Kind.NEWLINE) || at(Kind.EOF)) {
                return;
            }
            diagnostic(LsDiagnostic.Code.PARSE_UNEXPECTED_TOKEN,
                    "Unexpected token after " + context + "; expected end of line", current().range());
            skipToLineEnd();
        }

        private void unexpected(String message, Token token) {
            diagnostic(LsDiagnostic.Code.PARSE_UNEXPECTED_TOKEN, message, token.range());
            skipLine();
        }

        private void skipLine() {
            skipToLineEnd();
            if (at(Kind.NEWLINE)) {
                advance();
            }
        }

        private void skipToLineEnd() {
            while (!at(Kind.EOF) && !at(Kind.NEWLINE)) {
                advance();
            }
        }

        private void skipNewlines() {
            while (at(Kind.NEWLINE)) {
                advance();
            }
        }

        private boolean at(Kind kind) {
            return current().kind() == kind;
        }

        private Token current() {
            return tokens.get(Math.min(index, tokens.size() - 1));
        }

        private Token advance() {
            Token token = current();
            if (index < tokens.size() - 1) {
                index++;
            }
            return token;
        }

        private void diagnostic(LsDiagnostic.Code code, String message, SourceRange range) {
            diagnostics.add(new LsDiagnostic(code, message, range));
        }
    }
}
