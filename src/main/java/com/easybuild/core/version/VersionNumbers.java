package com.easybuild.core.version;

import com.easybuild.core.model.IncrementType;

import java.util.Optional;

/**
 * Pure functions over {@code MAJOR.MINOR.PATCH[+BUILD]} version strings.
 */
public final class VersionNumbers {

    private VersionNumbers() {
        // utility class
    }

    /**
     * Three numeric version components.
     */
    public record Triplet(int major, int minor, int patch) {

        /**
         * Android {@code versionCode} derived as {@code major*10000 + minor*100 + patch}.
         *
         * @throws ArithmeticException if the code does not fit in an {@code int}
         */
        public int androidVersionCode() {
            return Math.addExact(
                    Math.addExact(Math.multiplyExact(major, 10000), Math.multiplyExact(minor, 100)),
                    patch);
        }

        @Override
        public String toString() {
            return major + "." + minor + "." + patch;
        }
    }

    /**
     * Computes the next version. Never throws.
     *
     * <p>A trailing {@code +build} suffix is dropped and a two-part version is read as
     * {@code X.Y.0}. Anything that still is not three integers gets {@code ".1"} appended
     * to the original input.
     */
    public static String increment(String version, IncrementType type) {
        String original = version == null ? "" : version;
        int plus = original.indexOf('+');
        String base = plus >= 0 ? original.substring(0, plus) : original;

        String[] parts = base.split("\\.", -1);
        if (parts.length == 2) {
            parts = new String[]{parts[0], parts[1], "0"};
        } else if (parts.length != 3) {
            return original + ".1";
        }

        Optional<Triplet> parsed = toTriplet(parts);
        if (parsed.isEmpty()) {
            return original + ".1";
        }
        Triplet t = parsed.get();
        IncrementType kind = type == null ? IncrementType.PATCH : type;
        return switch (kind) {
            case MAJOR -> new Triplet(t.major() + 1, 0, 0).toString();
            case MINOR -> new Triplet(t.major(), t.minor() + 1, 0).toString();
            case PATCH -> new Triplet(t.major(), t.minor(), t.patch() + 1).toString();
        };
    }

    public static String increment(String version, String type) {
        return increment(version, IncrementType.fromString(type));
    }

    /**
     * Parses a version that is exactly three dot-separated integers, with no build suffix.
     */
    public static Optional<Triplet> parseExact(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String[] parts = version.strip().split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        return toTriplet(parts);
    }

    private static Optional<Triplet> toTriplet(String[] parts) {
        try {
            return Optional.of(new Triplet(
                    Integer.parseInt(parts[0].strip()),
                    Integer.parseInt(parts[1].strip()),
                    Integer.parseInt(parts[2].strip())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
