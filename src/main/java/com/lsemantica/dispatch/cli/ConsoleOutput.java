package com.lsemantica.dispatch.cli;

import com.lsemantica.core.model.Decision;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the governance CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) L-SEMANTICA GOVERNANCE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void issue(String path, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(red) -|@ " + path + " " + message));
    }

    public static void decision(String stage, Decision decision, String reason) {
        String color = switch (decision) {
            case CONTINUE -> "fg(green)";
            case ESCALATE -> "fg(yellow)";
            case STOP -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [" + stage.toUpperCase() + "]|@ @|" + color + ",bold " + decision.wireValue() + "|@ "
                        + reason));
    }

    public static void json(String json) {
        System.out.println(json);
    }
}
