package com.easybuild.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for EasyBuild.
 * Routes to subcommands: release, version, projects.
 */
@Command(
        name = "easybuild",
        mixinStandardHelpOptions = true,
        version = "EasyBuild 0.1.0",
        description = "Release preparation for Flutter, .NET MAUI and Xamarin projects",
        subcommands = {
                ReleaseCommand.class,
                VersionCommand.class,
                ProjectsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EasyBuildCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
