package com.easybuild.dispatch.cli;

import com.easybuild.core.catalog.ProjectCatalog;
import com.easybuild.core.model.PipelineResult;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import com.easybuild.core.model.ReleasePreview;
import com.easybuild.core.model.ReleaseStage;
import com.easybuild.core.release.ReleasePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for the EasyBuild CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Project SHOP = new Project("shop", ProjectType.FLUTTER, "https://example.com/shop.git",
            "dev", "release", "/srv/easybuild/shop", "pubspec.yaml");

    private ReleasePipeline pipeline;
    private ProjectCatalog catalog;

    @BeforeEach
    void setUp() {
        pipeline = mock(ReleasePipeline.class);
        catalog = mock(ProjectCatalog.class);
        when(catalog.find(anyString())).thenReturn(Optional.empty());
        when(catalog.find("shop")).thenReturn(Optional.of(SHOP));
        when(catalog.list()).thenReturn(List.of(SHOP));
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ReleaseCommand.class) {
                    return (K) new ReleaseCommand(pipeline, catalog);
                }
                if (cls == VersionCommand.class) {
                    return (K) new VersionCommand(pipeline, catalog);
                }
                if (cls == ProjectsCommand.class) {
                    return (K) new ProjectsCommand(catalog);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new EasyBuildCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("release"));
            assertTrue(result.output().contains("version"));
            assertTrue(result.output().contains("projects"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("EasyBuild 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommandPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: easybuild"));
        }
    }

    @Nested
    @DisplayName("release")
    class ReleaseTests {

        @Test
        @DisplayName("configured project is released, exit code 0")
        void releasesConfiguredProject() {
            when(pipeline.prepareRelease(eq(SHOP), isNull(), any())).thenReturn(
                    new PipelineResult(true, "Release prepared\n\nProject: shop", List.of(), null, "1.0.0", "1.0.1"));

            CliResult result = execute("release", "--project", "shop");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Release prepared"));
        }

        @Test
        @DisplayName("failed pipeline gives exit code 1")
        void failedPipeline() {
            when(pipeline.prepareRelease(any(), any(), any())).thenReturn(
                    new PipelineResult(false, "Release of shop failed at step 4 (Merge dev into release)",
                            List.of("Pull release branch: offline"), ReleaseStage.MERGE, "1.0.0", null));

            CliResult result = execute("release", "-p", "shop");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("failed at step 4"));
            assertTrue(result.output().contains("Pull release branch: offline"));
        }

        @Test
        @DisplayName("target version is passed through")
        void targetVersion() {
            when(pipeline.prepareRelease(any(), any(), any())).thenReturn(
                    new PipelineResult(true, "ok", List.of(), null, "1.0.0", "2.0.0"));

            execute("release", "--project", "shop", "--target-version", "2.0.0");

            verify(pipeline).prepareRelease(eq(SHOP), eq("2.0.0"), any());
        }

        @Test
        @DisplayName("malformed target version is rejected before the pipeline runs")
        void invalidTargetVersion() {
            CliResult result = execute("release", "--project", "shop", "--target-version", "2.0");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid version"));
            verifyNoInteractions(pipeline);
        }

        @Test
        void unknownProjectIsRejected() {
            CliResult result = execute("release", "--project", "nope");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown project: nope"));
            verifyNoInteractions(pipeline);
        }

        @Test
        @DisplayName("ad-hoc project is built from options")
        void adHocProject() {
            when(pipeline.prepareRelease(any(), any(), any())).thenReturn(
                    new PipelineResult(true, "ok", List.of(), null, "1.0.0", "1.0.1"));

            CliResult result = execute("release", "--type", "xamarin", "--git-url", "https://example.com/legacy.git",
                    "--path", "/tmp/legacy", "--dev-branch", "develop");

            assertEquals(0, result.exitCode(), result.output());
            ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
            verify(pipeline).prepareRelease(captor.capture(), isNull(), any());
            Project project = captor.getValue();
            assertEquals("legacy", project.name());
            assertEquals(ProjectType.XAMARIN, project.type());
            assertEquals("develop", project.devBranch());
            assertEquals("release", project.releaseBranch());
        }

        @Test
        @DisplayName("ad-hoc Flutter project needs a descriptor")
        void adHocFlutterNeedsDescriptor() {
            CliResult result = execute("release", "--type", "flutter", "--git-url", "u", "--path", "/tmp/app");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--descriptor is required"));
        }

        @Test
        @DisplayName("filesystem root is rejected as a project path")
        void rootPathRejected() {
            CliResult result = execute("release", "--type", "xamarin", "--git-url", "u", "--path", "/");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--path must name a project directory"));
            verifyNoInteractions(pipeline);
        }

        @Test
        void missingProjectSelection() {
            CliResult result = execute("release");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Either --project"));
        }
    }

    @Nested
    @DisplayName("version")
    class VersionTests {

        @Test
        void showsCurrentAndNextVersion() {
            when(pipeline.preview(SHOP)).thenReturn(new ReleasePreview("1.2.3+4", "1.2.4", true, "pubspec.yaml"));

            CliResult result = execute("version", "--project", "shop");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("1.2.3+4"));
            assertTrue(result.output().contains("1.2.4"));
        }

        @Test
        void versionNotFound() {
            when(pipeline.preview(SHOP)).thenReturn(new ReleasePreview(null, null, false, "No version line in pubspec.yaml"));

            CliResult result = execute("version", "--project", "shop");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No version line"));
        }
    }

    @Nested
    @DisplayName("projects")
    class ProjectsTests {

        @Test
        void listsConfiguredProjects() {
            CliResult result = execute("projects");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("shop"));
            assertTrue(result.output().contains("flutter"));
            assertTrue(result.output().contains("dev -> release"));
        }

        @Test
        void emptyCatalog() {
            when(catalog.list()).thenReturn(List.of());
            CliResult result = execute("projects");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No projects configured"));
        }
    }
}
