package com.easybuild.dispatch.cli;

import com.easybuild.core.catalog.ProjectCatalog;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ReleasePreview;
import com.easybuild.core.release.ReleasePipeline;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command: easybuild version
 * <p>
 * Shows the version on the release branch and the suggested next version.
 */
@Command(name = "version", mixinStandardHelpOptions = true, description = "Show current and next version")
@Component
public class VersionCommand implements Callable<Integer> {

    @Mixin
    private ProjectOptions projectOptions = new ProjectOptions();

    @Spec
    private CommandSpec spec;

    private final ReleasePipeline pipeline;
    private final ProjectCatalog catalog;

    public VersionCommand(ReleasePipeline pipeline, ProjectCatalog catalog) {
        this.pipeline = pipeline;
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        Project project = projectOptions.resolve(catalog, spec);
        ConsoleOutput.printBanner();

        ReleasePreview preview = pipeline.preview(project);
        if (!preview.found()) {
            ConsoleOutput.error("Current version of " + project.name() + " not found");
            ConsoleOutput.error(preview.detail());
            return 1;
        }
        ConsoleOutput.info("Project: " + project.name() + " (" + project.type().displayName() + ")");
        ConsoleOutput.info("Current version: " + preview.currentVersion());
        ConsoleOutput.success("Next version: " + preview.suggestedVersion());
        return 0;
    }
}
