package com.easybuild.dispatch.cli;

import com.easybuild.core.catalog.ProjectCatalog;
import com.easybuild.core.model.Project;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: easybuild projects
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List configured projects")
@Component
public class ProjectsCommand implements Runnable {

    private final ProjectCatalog catalog;

    public ProjectsCommand(ProjectCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Project> projects = catalog.list();
        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects configured (easybuild.projects)");
            return;
        }

        System.out.println();
        System.out.printf("  %-20s %-12s %-22s %s%n", "PROJECT", "TYPE", "BRANCHES", "PATH");
        System.out.println("  " + "-".repeat(72));
        for (Project p : projects) {
            System.out.printf("  %-20s %-12s %-22s %s%n",
                    truncate(p.name(), 20), p.type().value(),
                    truncate(p.devBranch() + " -> " + p.releaseBranch(), 22), p.localRepoPath());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
