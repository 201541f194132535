package com.easybuild.core.catalog;

import com.easybuild.core.catalog.ProjectCatalogProperties.ProjectDefinition;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves configured projects by name.
 *
 * <p>Entries with an unknown type or without a git URL are reported and left out;
 * they never make the catalog fail as a whole.
 */
@Service
public class ProjectCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProjectCatalog.class);

    private final ProjectCatalogProperties properties;

    public ProjectCatalog(ProjectCatalogProperties properties) {
        this.properties = properties;
    }

    public Optional<Project> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<String, ProjectDefinition> entry : properties.getProjects().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name.strip())) {
                return toProject(entry.getKey(), entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * All valid configured projects, in configuration order.
     */
    public List<Project> list() {
        var projects = new ArrayList<Project>();
        properties.getProjects().forEach((name, definition) ->
                toProject(name, definition).ifPresent(projects::add));
        return projects;
    }

    private Optional<Project> toProject(String name, ProjectDefinition definition) {
        ProjectType type;
        try {
            type = ProjectType.fromValue(definition.getType());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring project '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
        if (definition.getGitUrl() == null || definition.getGitUrl().isBlank()) {
            log.warn("Ignoring project '{}': no git-url configured", name);
            return Optional.empty();
        }
        String localPath = definition.getLocalPath();
        if (localPath == null || localPath.isBlank()) {
            localPath = Path.of(properties.getWorkspaceRoot(), name).toString();
        }
        return Optional.of(new Project(name, type, definition.getGitUrl(),
                definition.getDevBranch(), definition.getReleaseBranch(),
                localPath, definition.getProjectFile()));
    }
}
