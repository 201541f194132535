package com.easybuild.core.release;

import com.easybuild.core.git.GitOperations;
import com.easybuild.core.git.GitResult;
import com.easybuild.core.logging.MdcContext;
import com.easybuild.core.metrics.ReleaseMetrics;
import com.easybuild.core.model.IncrementType;
import com.easybuild.core.model.PipelineResult;
import com.easybuild.core.model.PlatformUpdateOutcome;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ReleasePreview;
import com.easybuild.core.model.ReleaseStage;
import com.easybuild.core.model.VersionLookup;
import com.easybuild.core.model.VersionUpdate;
import com.easybuild.core.version.VersionService;
import com.easybuild.core.version.VersionServiceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prepares a release: merges the dev branch into the release branch, bumps the version
 * in the project's descriptor(s), commits {@code #Release <version>} and pushes.
 *
 * <p>Stages run strictly in order, each one a blocking call. The first failing mandatory
 * stage ends the run; nothing is retried and nothing that earlier stages did to the
 * working copy is rolled back. In particular a conflicting merge is left in place for
 * manual resolution.
 *
 * <p>The working copy is not locked. Running two releases against the same local path
 * at the same time is unsafe and must be prevented by the caller.
 */
@Service
public class ReleasePipeline {

    private static final Logger log = LoggerFactory.getLogger(ReleasePipeline.class);

    private final GitOperations git;
    private final VersionServiceFactory versionServices;
    private final ReleaseProperties properties;
    private final ReleaseMetrics metrics;

    private final List<Stage> stages = List.of(
            new Stage(ReleaseStage.ENSURE_REPOSITORY, this::ensureRepository),
            new Stage(ReleaseStage.CHECKOUT_DEV, this::checkoutDev),
            new Stage(ReleaseStage.PULL_DEV, this::pullDev),
            new Stage(ReleaseStage.CHECKOUT_RELEASE, this::checkoutRelease),
            new Stage(ReleaseStage.PULL_RELEASE, this::pullRelease),
            new Stage(ReleaseStage.MERGE, this::mergeDevIntoRelease),
            new Stage(ReleaseStage.DETERMINE_VERSION, this::determineCurrentVersion),
            new Stage(ReleaseStage.COMPUTE_VERSION, this::computeNextVersion),
            new Stage(ReleaseStage.APPLY_VERSION, this::applyVersion),
            new Stage(ReleaseStage.COMMIT, this::stageAndCommit),
            new Stage(ReleaseStage.PUSH, this::push),
            new Stage(ReleaseStage.SUMMARIZE, this::summarize)
    );

    public ReleasePipeline(GitOperations git,
                           VersionServiceFactory versionServices,
                           ReleaseProperties properties,
                           ReleaseMetrics metrics) {
        this.git = git;
        this.versionServices = versionServices;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs the full release preparation.
     *
     * @param project       project to release
     * @param targetVersion explicit version to release, or {@code null}/blank to increment
     *                      the version found on the release branch
     * @param listener      receives progress messages after the major stages
     * @return aggregate outcome; never {@code null}, never throws for expected failures
     */
    public PipelineResult prepareRelease(Project project, String targetVersion, ReleaseProgressListener listener) {
        MdcContext.setRelease(project.name());
        try {
            Optional<VersionService> service = versionServices.forType(project.type());
            if (service.isEmpty()) {
                String message = "Project type %s is not supported for automatic versioning".formatted(project.type());
                log.warn(message);
                notify(listener, message);
                metrics.recordReleaseResult(String.valueOf(project.type()), false);
                return new PipelineResult(false, message, List.of(), null, null, null);
            }

            log.info("Preparing release of {} ({}), target version: {}", project.name(), project.type(),
                    isBlank(targetVersion) ? "auto" : targetVersion);
            var run = new ReleaseRun(project, service.get(), isBlank(targetVersion) ? null : targetVersion.strip());
            var completed = new ArrayList<ReleaseStage>();

            for (Stage stage : stages) {
                MdcContext.setStage(project.name(), stage.id().name());
                long start = System.currentTimeMillis();
                StageOutcome outcome = execute(stage, run);
                metrics.recordStage(stage.id().name(), outcome.success(), System.currentTimeMillis() - start);

                if (!outcome.success()) {
                    String message = failureMessage(project, stage.id(), outcome.detail(), completed);
                    log.error("Release of {} stopped at {}: {}", project.name(), stage.id(), outcome.detail());
                    notify(listener, message);
                    metrics.recordReleaseResult(project.type().value(), false);
                    return new PipelineResult(false, message, run.diagnostics, stage.id(),
                            run.currentVersion, run.newVersion);
                }

                completed.add(stage.id());
                if (outcome.progress() != null) {
                    notify(listener, outcome.progress());
                }
            }

            log.info("Release {} of {} prepared", run.newVersion, project.name());
            metrics.recordReleaseResult(project.type().value(), true);
            return new PipelineResult(true, run.summary, run.diagnostics, null, run.currentVersion, run.newVersion);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reads the version currently on the release branch and suggests the next one,
     * without merging or writing anything. Clones the repository if needed and leaves
     * the working copy on the release branch.
     */
    public ReleasePreview preview(Project project) {
        MdcContext.setRelease(project.name());
        try {
            Optional<VersionService> service = versionServices.forType(project.type());
            if (service.isEmpty()) {
                return new ReleasePreview(null, null, false,
                        "Project type %s is not supported".formatted(project.type()));
            }

            GitResult cloned = git.cloneRepository(project);
            if (!cloned.success()) {
                return new ReleasePreview(null, null, false, cloned.detail());
            }
            GitResult checkout = git.checkout(project.repoPath(), project.releaseBranch());
            if (!checkout.success()) {
                return new ReleasePreview(null, null, false, checkout.detail());
            }
            GitResult pulled = git.pull(project.repoPath(), project.releaseBranch());
            if (!pulled.success()) {
                log.warn("Reading version from a stale release branch: {}", pulled.detail());
            }

            VersionLookup lookup = service.get().getCurrentVersion(project);
            if (!lookup.found()) {
                return new ReleasePreview(null, null, false, lookup.detail());
            }
            String suggested = service.get().incrementVersion(lookup.version(), incrementType());
            return new ReleasePreview(lookup.version(), suggested, true, lookup.detail());
        } finally {
            MdcContext.clear();
        }
    }

    // -- stages -----------------------------------------------------------------

    private StageOutcome ensureRepository(ReleaseRun run) {
        return fromGit(git.cloneRepository(run.project));
    }

    private StageOutcome checkoutDev(ReleaseRun run) {
        return fromGit(git.checkout(run.project.repoPath(), run.project.devBranch()));
    }

    private StageOutcome pullDev(ReleaseRun run) {
        GitResult result = git.pull(run.project.repoPath(), run.project.devBranch());
        if (result.success() && !isBlank(result.detail())) {
            run.diagnostics.add("%s: %s".formatted(ReleaseStage.PULL_DEV.label(), result.detail()));
        }
        return fromGit(result);
    }

    private StageOutcome checkoutRelease(ReleaseRun run) {
        return fromGit(git.checkout(run.project.repoPath(), run.project.releaseBranch()));
    }

    private StageOutcome pullRelease(ReleaseRun run) {
        GitResult result = git.pull(run.project.repoPath(), run.project.releaseBranch());
        if (!result.success() || !isBlank(result.detail())) {
            // non-fatal: the merge below still works against the local release branch
            log.warn("Pull of release branch reported a problem: {}", result.detail());
            run.diagnostics.add("%s: %s".formatted(ReleaseStage.PULL_RELEASE.label(), result.detail()));
        }
        return StageOutcome.ok();
    }

    private StageOutcome mergeDevIntoRelease(ReleaseRun run) {
        Project project = run.project;
        String message = "Merge %s into %s".formatted(project.devBranch(), project.releaseBranch());
        GitResult result = git.merge(project.repoPath(), project.devBranch(), message);
        if (!result.success()) {
            return StageOutcome.failed(result.detail()
                    + "\nThe working copy is left mid-merge for manual resolution.");
        }
        return StageOutcome.ok("Merged %s into %s".formatted(project.devBranch(), project.releaseBranch()));
    }

    private StageOutcome determineCurrentVersion(ReleaseRun run) {
        VersionLookup lookup = run.service.getCurrentVersion(run.project);
        if (lookup.found()) {
            run.currentVersion = lookup.version();
            log.info("Current version on {}: {} ({})", run.project.releaseBranch(), lookup.version(), lookup.detail());
            return StageOutcome.ok();
        }
        if (run.targetVersion != null) {
            run.diagnostics.add("%s: %s".formatted(ReleaseStage.DETERMINE_VERSION.label(), lookup.detail()));
            log.warn("Current version unknown, continuing with explicit target {}: {}", run.targetVersion, lookup.detail());
            return StageOutcome.ok();
        }
        String guidance = run.service.expectedVersionLocation();
        String detail = lookup.detail() == null ? "" : lookup.detail();
        if (!detail.contains(guidance)) {
            detail = detail + "\n" + guidance;
        }
        return StageOutcome.failed("Could not determine the current version of %s: %s"
                .formatted(run.project.name(), detail));
    }

    private StageOutcome computeNextVersion(ReleaseRun run) {
        run.newVersion = run.targetVersion != null
                ? run.targetVersion
                : run.service.incrementVersion(run.currentVersion, incrementType());
        String progress = run.currentVersion == null
                ? "New version: %s".formatted(run.newVersion)
                : "Current version: %s\nNew version: %s".formatted(run.currentVersion, run.newVersion);
        return StageOutcome.ok(progress);
    }

    private StageOutcome applyVersion(ReleaseRun run) {
        VersionUpdate update = run.service.updateVersion(run.project, run.newVersion);
        metrics.recordVersionUpdate(run.project.type().value(), update.success());
        for (PlatformUpdateOutcome outcome : update.outcomes()) {
            run.diagnostics.add(outcome.describe());
        }
        if (!update.success()) {
            return StageOutcome.failed(update.message());
        }
        return StageOutcome.ok(update.message());
    }

    private StageOutcome stageAndCommit(ReleaseRun run) {
        GitResult staged = git.stageAll(run.project.repoPath());
        if (!staged.success()) {
            return fromGit(staged);
        }
        return fromGit(git.commit(run.project.repoPath(), properties.getCommitMessagePrefix() + run.newVersion));
    }

    private StageOutcome push(ReleaseRun run) {
        GitResult result = git.push(run.project.repoPath(), run.project.releaseBranch());
        if (!result.success()) {
            return fromGit(result);
        }
        return StageOutcome.ok("Pushed %s to origin".formatted(run.project.releaseBranch()));
    }

    private StageOutcome summarize(ReleaseRun run) {
        String changelog = "";
        try {
            GitResult recent = git.log(run.project.repoPath(), properties.getChangelogSize());
            if (recent.success() && !isBlank(recent.output())) {
                changelog = recent.output();
            } else {
                run.diagnostics.add("%s: no changelog (%s)".formatted(ReleaseStage.SUMMARIZE.label(), recent.detail()));
            }
        } catch (RuntimeException e) {
            log.warn("Could not collect recent commits: {}", e.getMessage(), e);
            run.diagnostics.add("%s: no changelog (%s)".formatted(ReleaseStage.SUMMARIZE.label(), e.getMessage()));
        }

        var summary = new StringBuilder();
        summary.append("Release prepared\n\n");
        summary.append("Project: ").append(run.project.name()).append('\n');
        if (run.currentVersion != null) {
            summary.append("Version: ").append(run.currentVersion).append(" -> ").append(run.newVersion);
        } else {
            summary.append("Version: ").append(run.newVersion);
        }
        if (!changelog.isEmpty()) {
            summary.append("\n\nRecent commits:\n").append(changelog);
        }
        run.summary = summary.toString();
        return StageOutcome.ok(run.summary);
    }

    // -- plumbing ---------------------------------------------------------------

    private StageOutcome execute(Stage stage, ReleaseRun run) {
        try {
            return stage.action().apply(run);
        } catch (RuntimeException e) {
            log.error("Unexpected error in stage {}", stage.id(), e);
            return StageOutcome.failed("Unexpected error: " + e.getMessage());
        }
    }

    private void notify(ReleaseProgressListener listener, String message) {
        if (listener == null) {
            return;
        }
        try {
            listener.send(message).get(properties.getNotifyTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Progress notification was not delivered: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while delivering progress notification");
        }
    }

    private String failureMessage(Project project, ReleaseStage stage, String detail, List<ReleaseStage> completed) {
        var message = new StringBuilder();
        message.append("Release of %s failed at step %d (%s):\n"
                .formatted(project.name(), stage.step(), stage.label()));
        message.append(detail);
        if (!completed.isEmpty()) {
            message.append("\n\nCompleted: ")
                    .append(completed.stream().map(ReleaseStage::label).collect(Collectors.joining(", ")));
            message.append("\nChanges made by completed steps are not rolled back.");
        }
        return message.toString();
    }

    private IncrementType incrementType() {
        return IncrementType.fromString(properties.getIncrementType());
    }

    private static StageOutcome fromGit(GitResult result) {
        return result.success() ? StageOutcome.ok() : StageOutcome.failed(result.detail());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Stage(ReleaseStage id, Function<ReleaseRun, StageOutcome> action) {}

    /**
     * Outcome of one stage.
     *
     * @param progress message for the progress listener, {@code null} for quiet stages
     */
    private record StageOutcome(boolean success, String detail, String progress) {

        static StageOutcome ok() {
            return new StageOutcome(true, "", null);
        }

        static StageOutcome ok(String progress) {
            return new StageOutcome(true, "", progress);
        }

        static StageOutcome failed(String detail) {
            return new StageOutcome(false, detail, null);
        }
    }

    /**
     * Mutable state of one run, discarded when the run ends.
     */
    private static final class ReleaseRun {
        final Project project;
        final VersionService service;
        final String targetVersion;
        final List<String> diagnostics = new ArrayList<>();
        String currentVersion;
        String newVersion;
        String summary = "";

        ReleaseRun(Project project, VersionService service, String targetVersion) {
            this.project = project;
            this.service = service;
            this.targetVersion = targetVersion;
        }
    }
}
