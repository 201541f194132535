package com.easybuild.core.model;

import java.nio.file.Path;

/**
 * What happened to one platform file during a version update.
 */
public record PlatformUpdateOutcome(
    Path file,
    PlatformKind kind,
    Status status,
    String detail
) {

    public enum Status { UPDATED, FAILED, SKIPPED }

    public boolean success() {
        return status == Status.UPDATED;
    }

    public String describe() {
        return "%s [%s] %s: %s".formatted(file, kind.displayName(), status, detail);
    }
}
