package com.lsemantica.core.lsdoc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LsDocumentReaderTest {

    private static final String VALID = """
            goal "Ship release"
            capability deploy "Deploys the build"
            capability notify "Posts to chat"
            check smoke "Runs smoke tests"
            """;

    @Nested
    @DisplayName("Valid documents")
    class ValidTests {

        @Test
        @DisplayName("parses goal, capabilities and checks in order")
        void parsesDocument() {
            LsDocumentReader.Result result = LsDocumentReader.read(VALID);

            assertTrue(result.diagnostics().isEmpty());
            LsDocument document = result.documentIfValid().orElseThrow();
            assertEquals("Ship release", document.goal().value());
            assertEquals(2, document.capabilities().size());
            assertEquals("notify", document.capabilities().get(1).name());
            assertEquals("Runs smoke tests", document.checks().get(0).description());
            assertEquals(1, document.range().start().line());
            assertEquals(4, document.range().end().line());
        }

        @Test
        @DisplayName("decodes string escapes and tolerates CRLF and blank lines")
        void escapesAndLineEndings() {
            String source = "\r\ngoal \"Say \\\"hi\\\"\\tnow\"\r\n\r\ncapability c1 \"x\"\r\ncheck k \"y\"";

            LsDocument document = LsDocumentReader.read(source).documentIfValid().orElseThrow();
            assertEquals("Say \"hi\"\tnow", document.goal().value());
        }

        @Test
        @DisplayName("the bundled example parses")
        void bundledExample() throws IOException {
            try (InputStream in = LsDocumentReaderTest.class.getResourceAsStream("/examples/first-executable.ls")) {
                assertNotNull(in);
                String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                assertEquals("Ship release notes for v0.1.0",
                        LsDocumentReader.read(source).documentIfValid().orElseThrow().goal().value());
            }
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class DiagnosticTests {

        @Test
        @DisplayName("an unterminated goal string is a lexer error with its position")
        void unterminatedString() {
            LsDocumentReader.Result result = LsDocumentReader.read("goal \"Ship release\ncapability a \"b\"\ncheck c \"d\"");

            assertTrue(result.documentIfValid().isEmpty());
            LsDiagnostic diagnostic = result.diagnostics().get(0);
            assertEquals(LsDiagnostic.Code.LEX_UNTERMINATED_STRING, diagnostic.code());
            assertEquals(1, diagnostic.range().start().line());
            assertEquals(6, diagnostic.range().start().column());
        }

        @Test
        @DisplayName("unexpected characters and bad escapes are reported")
        void lexerErrors() {
            assertEquals(LsDiagnostic.Code.LEX_UNEXPECTED_CHARACTER,
                    LsDocumentReader.read("goal \"x\" @").diagnostics().get(0).code());
            assertEquals(LsDiagnostic.Code.LEX_INVALID_ESCAPE,
                    LsDocumentReader.read("goal \"\\q\"").diagnostics().get(0).code());
        }

        @Test
        @DisplayName("a document must start with a goal")
        void mustStartWithGoal() {
            LsDocumentReader.Result result = LsDocumentReader.read("capability a \"b\"\ncheck c \"d\"\n");

            assertEquals(LsDiagnostic.Code.PARSE_EXPECTED_DECLARATION, result.diagnostics().get(0).code());
        }

        @Test
        @DisplayName("capabilities are not allowed after checks")
        void capabilityAfterCheck() {
            LsDocumentReader.Result result = LsDocumentReader.read(
                    "goal \"g\"\ncapability a \"b\"\ncheck c \"d\"\ncapability e \"f\"\n");

            assertEquals(1, result.diagnostics().size());
            assertEquals(LsDiagnostic.Code.PARSE_UNEXPECTED_TOKEN, result.diagnostics().get(0).code());
            assertEquals(4, result.diagnostics().get(0).range().start().line());
        }

        @Test
        @DisplayName("missing capability and check sections are both reported")
        void missingSections() {
            LsDocumentReader.Result result = LsDocumentReader.read("goal \"g\"\n");

            assertEquals(2, result.diagnostics().size());
            assertTrue(result.diagnostics().stream()
                    .allMatch(d -> d.code() == LsDiagnostic.Code.PARSE_MISSING_REQUIRED_DECLARATION));
        }

        @Test
        @DisplayName("a second goal is rejected")
        void secondGoal() {
            LsDocumentReader.Result result = LsDocumentReader.read(
                    "goal \"g\"\ngoal \"h\"\ncapability a \"b\"\ncheck c \"d\"\n");

            assertEquals("Unexpected 'goal' declaration: only one goal declaration is allowed",
                    result.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("trailing tokens on a declaration line are rejected")
        void trailingTokens() {
            LsDocumentReader.Result result = LsDocumentReader.read(
                    "goal \"g\" extra\ncapability a \"b\"\ncheck c \"d\"\n");

            assertEquals(LsDiagnostic.Code.PARSE_UNEXPECTED_TOKEN, result.diagnostics().get(0).code());
        }

        @Test
        @DisplayName("null source is treated as empty")
        void nullSource() {
            assertFalse(LsDocumentReader.read(null).diagnostics().isEmpty());
        }
    }
}
