package com.easybuild.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate outcome of one release pipeline run.
 *
 * @param success        whether every mandatory stage succeeded
 * @param message        formatted status report
 * @param diagnostics    per-stage and per-file notes collected during the run
 * @param failedStage    stage that aborted the run, {@code null} on success or when the
 *                       run was rejected before any stage started
 * @param currentVersion version read from the release branch, if any
 * @param newVersion     version written, if computed
 */
public record PipelineResult(
    boolean success,
    String message,
    List<String> diagnostics,
    ReleaseStage failedStage,
    String currentVersion,
    String newVersion
) {

    public PipelineResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public Optional<ReleaseStage> failedStageOpt() {
        return Optional.ofNullable(failedStage);
    }
}
