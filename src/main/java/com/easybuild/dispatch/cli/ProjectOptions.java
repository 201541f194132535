package com.easybuild.dispatch.cli;

import com.easybuild.core.catalog.ProjectCatalog;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.nio.file.Path;

/**
 * Selects the project a command works on: either a configured project by name,
 * or an ad-hoc project described on the command line.
 */
public class ProjectOptions {

    @Option(names = {"--project", "-p"}, description = "Configured project name")
    String projectName;

    @Option(names = "--type", description = "Ecosystem of an ad-hoc project: flutter, dotnet_maui, xamarin")
    String type;

    @Option(names = "--git-url", description = "Remote of an ad-hoc project")
    String gitUrl;

    @Option(names = "--path", description = "Local working copy of an ad-hoc project")
    String localPath;

    @Option(names = "--descriptor", description = "Descriptor path relative to the working copy (pubspec.yaml, *.csproj)")
    String descriptor;

    @Option(names = "--dev-branch", defaultValue = "dev", description = "Dev branch (default: ${DEFAULT-VALUE})")
    String devBranch;

    @Option(names = "--release-branch", defaultValue = "release", description = "Release branch (default: ${DEFAULT-VALUE})")
    String releaseBranch;

    /**
     * @throws ParameterException when neither a known project nor a complete ad-hoc description is given
     */
    Project resolve(ProjectCatalog catalog, CommandSpec spec) {
        if (projectName != null && !projectName.isBlank()) {
            return catalog.find(projectName).orElseThrow(() -> new ParameterException(spec.commandLine(),
                    "Unknown project: " + projectName + " (see 'easybuild projects')"));
        }
        if (type == null || gitUrl == null || localPath == null) {
            throw new ParameterException(spec.commandLine(),
                    "Either --project or all of --type, --git-url and --path are required");
        }
        ProjectType projectType;
        try {
            projectType = ProjectType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        if (projectType != ProjectType.XAMARIN && (descriptor == null || descriptor.isBlank())) {
            throw new ParameterException(spec.commandLine(),
                    "--descriptor is required for " + projectType.displayName() + " projects");
        }
        Path fileName = Path.of(localPath).getFileName();
        if (fileName == null) {
            throw new ParameterException(spec.commandLine(),
                    "--path must name a project directory, not " + localPath);
        }
        String name = fileName.toString();
        return new Project(name, projectType, gitUrl, devBranch, releaseBranch, localPath, descriptor);
    }
}
