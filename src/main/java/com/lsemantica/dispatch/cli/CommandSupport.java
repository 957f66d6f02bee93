package com.lsemantica.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.lsemantica.core.contract.ContractValidationException;
import com.lsemantica.core.contract.ContractValidationIssue;
import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.PipelineException;
import com.lsemantica.core.reliability.ReliabilityCorpusException;
import com.lsemantica.core.repair.RepairInputException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shared plumbing for subcommands: JSON file input, artifact output and the mapping from
 * outcomes to exit codes.
 */
final class CommandSupport {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_BLOCKED = 2;

    private CommandSupport() {}

    static int exitCode(Decision decision) {
        return decision.allowsContinuation() ? EXIT_OK : EXIT_BLOCKED;
    }

    static JsonNode readJson(Path path) {
        return CanonicalJson.readTree(path);
    }

    static <T> T readJson(Path path, Class<T> type) {
        return CanonicalJson.read(path, type);
    }

    static <T> T readJson(Path path, TypeReference<T> type) {
        return CanonicalJson.mapper().convertValue(CanonicalJson.readTree(path), type);
    }

    /**
     * Prints {@code value} as pretty JSON, or writes it to {@code output} when set.
     */
    static void emit(Object value, Path output, String label) {
        String json = CanonicalJson.writePretty(value);
        if (output == null) {
            ConsoleOutput.json(json);
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + label + " to " + output, e);
        }
        ConsoleOutput.success("Wrote " + label + " to " + output);
    }

    /**
     * Runs a command body, reporting input errors on the console with exit code
     * {@value #EXIT_ERROR}. Decisions are returned, never thrown, so they pass through.
     */
    static int guarded(Callable<Integer> body) throws Exception {
        try {
            return body.call();
        } catch (ContractValidationException e) {
            ConsoleOutput.error(e.getMessage());
            for (ContractValidationIssue issue : e.issues()) {
                ConsoleOutput.issue(issue.displayPath(), issue.message());
            }
            return EXIT_ERROR;
        } catch (PipelineException e) {
            ConsoleOutput.error("[" + e.codeName() + "] " + e.getMessage());
            return EXIT_ERROR;
        } catch (RepairInputException | ReliabilityCorpusException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
