package com.easybuild.dispatch.cli;

import com.easybuild.core.catalog.ProjectCatalog;
import com.easybuild.core.model.PipelineResult;
import com.easybuild.core.model.Project;
import com.easybuild.core.release.ReleasePipeline;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * CLI command: easybuild release
 * <p>
 * Merges dev into release, bumps the version, commits and pushes.
 * Exits 0 when the release was prepared, 1 when a stage failed.
 */
@Command(name = "release", mixinStandardHelpOptions = true, description = "Prepare a release")
@Component
public class ReleaseCommand implements Callable<Integer> {

    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    @Mixin
    private ProjectOptions projectOptions = new ProjectOptions();

    @Option(names = {"--target-version", "-v"}, description = "Release this version instead of incrementing the current one (X.Y.Z)")
    private String targetVersion;

    @Spec
    private CommandSpec spec;

    private final ReleasePipeline pipeline;
    private final ProjectCatalog catalog;

    public ReleaseCommand(ReleasePipeline pipeline, ProjectCatalog catalog) {
        this.pipeline = pipeline;
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        if (targetVersion != null && !VERSION.matcher(targetVersion.strip()).matches()) {
            throw new ParameterException(spec.commandLine(),
                    "Invalid version '" + targetVersion + "', expected X.Y.Z (e.g. 1.2.3)");
        }
        Project project = projectOptions.resolve(catalog, spec);

        ConsoleOutput.printBanner();
        ConsoleOutput.info("Preparing release of " + project.name() + " (" + project.type().displayName() + ")");
        ConsoleOutput.info("Merging " + project.devBranch() + " into " + project.releaseBranch());

        PipelineResult result = pipeline.prepareRelease(project, targetVersion, message -> {
            ConsoleOutput.progress(message);
            return CompletableFuture.completedFuture(null);
        });

        ConsoleOutput.result(result);
        return result.success() ? 0 : 1;
    }
}
