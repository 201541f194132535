package com.easybuild.core.model;

import java.nio.file.Path;

/**
 * A mobile project kept in git and prepared for release by the pipeline.
 *
 * @param name            human-readable project name
 * @param type            ecosystem, selects the version strategy
 * @param gitUrl          remote the working copy is cloned from
 * @param devBranch       integration branch merged into the release branch
 * @param releaseBranch   branch that receives the release commit
 * @param localRepoPath   working copy location; cloned when it does not exist yet
 * @param projectFilePath descriptor path relative to the working copy
 *                        (ignored for Xamarin, which discovers its platform files)
 */
public record Project(
    String name,
    ProjectType type,
    String gitUrl,
    String devBranch,
    String releaseBranch,
    String localRepoPath,
    String projectFilePath
) {

    public Path repoPath() {
        return Path.of(localRepoPath);
    }

    /**
     * Absolute location of the single descriptor file used by Flutter and MAUI projects.
     */
    public Path descriptorPath() {
        return repoPath().resolve(projectFilePath == null ? "" : projectFilePath);
    }
}
