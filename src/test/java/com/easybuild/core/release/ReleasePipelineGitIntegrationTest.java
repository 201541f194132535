package com.easybuild.core.release;

import com.easybuild.core.git.GitOperations;
import com.easybuild.core.git.GitProperties;
import com.easybuild.core.metrics.ReleaseMetrics;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import com.easybuild.core.model.ReleaseStage;
import com.easybuild.core.version.DotNetMauiVersionService;
import com.easybuild.core.version.FlutterVersionService;
import com.easybuild.core.version.PlatformProjectLocator;
import com.easybuild.core.version.VersionServiceFactory;
import com.easybuild.core.version.XamarinVersionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs the pipeline against real git repositories: a bare "remote" seeded with a
 * release and a dev branch, and a working copy the pipeline clones itself.
 */
class ReleasePipelineGitIntegrationTest {

    private static final String[] IDENTITY = {"-c", "user.name=Seed", "-c", "user.email=seed@example.com"};

    @TempDir
    Path root;

    private Path remote;
    private Path seed;
    private ReleasePipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git executable not available");

        remote = root.resolve("remote.git");
        seed = root.resolve("seed");
        git(root, "init", "--bare", remote.toString());
        git(root, "clone", remote.toString(), seed.toString());

        git(seed, "checkout", "-b", "release");
        Files.writeString(seed.resolve("pubspec.yaml"), "name: app\nversion: 1.2.3+4\n");
        git(seed, "add", ".");
        git(seed, "commit", "-m", "Initial release");
        git(seed, "push", "origin", "release");
        git(remote, "symbolic-ref", "HEAD", "refs/heads/release");

        git(seed, "checkout", "-b", "dev");
        Files.writeString(seed.resolve("feature.txt"), "login screen\n");
        git(seed, "add", ".");
        git(seed, "commit", "-m", "Add login screen");
        git(seed, "push", "origin", "dev");

        var gitProperties = new GitProperties();
        gitProperties.setAuthorName("Release Bot");
        gitProperties.setAuthorEmail("release@example.com");
        var factory = new VersionServiceFactory(new FlutterVersionService(), new DotNetMauiVersionService(),
                new XamarinVersionService(new PlatformProjectLocator()));
        pipeline = new ReleasePipeline(new GitOperations(gitProperties), factory,
                new ReleaseProperties(), new ReleaseMetrics(new SimpleMeterRegistry()));
    }

    private Project project() {
        return new Project("app", ProjectType.FLUTTER, remote.toString(), "dev", "release",
                root.resolve("workspace/app").toString(), "pubspec.yaml");
    }

    @Test
    @DisplayName("clones, merges dev, bumps the version and pushes the release commit")
    void preparesRelease() throws Exception {
        var progress = new ArrayList<String>();
        var result = pipeline.prepareRelease(project(), null, message -> {
            progress.add(message);
            return CompletableFuture.completedFuture(null);
        });

        assertTrue(result.success(), result.message());
        assertEquals("1.2.3+4", result.currentVersion());
        assertEquals("1.2.4", result.newVersion());
        assertTrue(result.message().contains("#Release 1.2.4"), "changelog lists the release commit");

        assertEquals("#Release 1.2.4", git(remote, "log", "-1", "--pretty=%s", "release"));
        assertEquals("Release Bot", git(remote, "log", "-1", "--pretty=%an", "release"));
        assertTrue(git(remote, "show", "release:pubspec.yaml").contains("version: 1.2.4"));
        assertEquals("login screen", git(remote, "show", "release:feature.txt"));
        assertFalse(progress.isEmpty());
    }

    @Test
    @DisplayName("preview reads the release branch without changing the remote")
    void preview() throws Exception {
        String before = git(remote, "rev-parse", "release");

        var preview = pipeline.preview(project());

        assertTrue(preview.found(), preview.detail());
        assertEquals("1.2.3+4", preview.currentVersion());
        assertEquals("1.2.4", preview.suggestedVersion());
        assertEquals(before, git(remote, "rev-parse", "release"));
    }

    @Test
    @DisplayName("conflicting merge is left in place")
    void conflictingMerge() throws Exception {
        git(seed, "checkout", "release");
        Files.writeString(seed.resolve("feature.txt"), "hotfix on release\n");
        git(seed, "add", ".");
        git(seed, "commit", "-m", "Hotfix");
        git(seed, "push", "origin", "release");

        var result = pipeline.prepareRelease(project(), null, ReleaseProgressListener.none());

        assertFalse(result.success());
        assertEquals(ReleaseStage.MERGE, result.failedStage());
        Path workingCopy = root.resolve("workspace/app");
        assertTrue(Files.exists(workingCopy.resolve(".git/MERGE_HEAD")), "merge is not aborted");
        assertEquals("Hotfix", git(remote, "log", "-1", "--pretty=%s", "release"));
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String git(Path dir, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(IDENTITY));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command).directory(dir.toFile()).redirectErrorStream(true).start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
        assertTrue(process.waitFor(60, TimeUnit.SECONDS), "git timed out: " + command);
        assertEquals(0, process.exitValue(), () -> command + " failed:\n" + output);
        return output;
    }
}
