package com.easybuild.dispatch.cli;

import com.easybuild.core.model.PipelineResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the EasyBuild CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) EASYBUILD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [EASYBUILD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [RELEASE]|@ " + message.replace("\n", "\n          ")));
    }

    public static void result(PipelineResult result) {
        System.out.println("──────────────────────────────────");
        if (result.success()) {
            success(result.message());
        } else {
            error(result.message());
        }
        if (!result.diagnostics().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Diagnostics|@"));
            for (String line : result.diagnostics()) {
                System.out.println("  - " + line);
            }
        }
    }
}
