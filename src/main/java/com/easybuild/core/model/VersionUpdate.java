package com.easybuild.core.model;

import java.util.List;

/**
 * Result of writing a new version into a project's descriptor(s).
 *
 * @param success  whether the version was written (for Xamarin: into at least one file)
 * @param message  formatted status report for the caller
 * @param outcomes per-file outcomes, empty for single-file ecosystems
 */
public record VersionUpdate(
    boolean success,
    String message,
    List<PlatformUpdateOutcome> outcomes
) {

    public VersionUpdate {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static VersionUpdate succeeded(String message) {
        return new VersionUpdate(true, message, List.of());
    }

    public static VersionUpdate failed(String message) {
        return new VersionUpdate(false, message, List.of());
    }
}
