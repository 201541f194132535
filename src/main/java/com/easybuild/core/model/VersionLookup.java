package com.easybuild.core.model;

/**
 * Result of reading the current version from a project's descriptor(s).
 *
 * @param version the version string, {@code null} when not found
 * @param found   whether a version was found
 * @param detail  where the version came from, or why none was found
 */
public record VersionLookup(
    String version,
    boolean found,
    String detail
) {

    public static VersionLookup found(String version, String source) {
        return new VersionLookup(version, true, source);
    }

    public static VersionLookup notFound(String reason) {
        return new VersionLookup(null, false, reason);
    }
}
