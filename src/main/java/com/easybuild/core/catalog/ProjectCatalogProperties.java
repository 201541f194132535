package com.easybuild.core.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projects known by name, bound from {@code easybuild.projects.<name>.*}.
 */
@Component
@ConfigurationProperties(prefix = "easybuild")
public class ProjectCatalogProperties {

    private String workspaceRoot = "./workspace";
    private Map<String, ProjectDefinition> projects = new LinkedHashMap<>();

    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public Map<String, ProjectDefinition> getProjects() { return projects; }
    public void setProjects(Map<String, ProjectDefinition> projects) { this.projects = projects; }

    public static class ProjectDefinition {
        private String type;
        private String gitUrl;
        private String devBranch = "dev";
        private String releaseBranch = "release";
        /** Working copy location; defaults to {@code <workspace-root>/<name>}. */
        private String localPath;
        /** Descriptor path relative to the working copy, unused for Xamarin. */
        private String projectFile;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getGitUrl() { return gitUrl; }
        public void setGitUrl(String gitUrl) { this.gitUrl = gitUrl; }
        public String getDevBranch() { return devBranch; }
        public void setDevBranch(String devBranch) { this.devBranch = devBranch; }
        public String getReleaseBranch() { return releaseBranch; }
        public void setReleaseBranch(String releaseBranch) { this.releaseBranch = releaseBranch; }
        public String getLocalPath() { return localPath; }
        public void setLocalPath(String localPath) { this.localPath = localPath; }
        public String getProjectFile() { return projectFile; }
        public void setProjectFile(String projectFile) { this.projectFile = projectFile; }
    }
}
