package com.easybuild.core.model;

/**
 * Version information shown before a release is started.
 *
 * @param currentVersion   version on the release branch, {@code null} when not found
 * @param suggestedVersion patch increment of the current version, {@code null} when not found
 * @param found            whether the current version could be read
 * @param detail           where the version came from, or why it could not be read
 */
public record ReleasePreview(
    String currentVersion,
    String suggestedVersion,
    boolean found,
    String detail
) {}
