package com.easybuild.core.model;

import java.util.Locale;

/**
 * Which component of a {@code MAJOR.MINOR.PATCH} version an increment bumps.
 */
public enum IncrementType {
    MAJOR,
    MINOR,
    PATCH;

    /**
     * Lenient lookup: anything that is not {@code major} or {@code minor} is a patch increment.
     */
    public static IncrementType fromString(String raw) {
        if (raw == null) {
            return PATCH;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "major" -> MAJOR;
            case "minor" -> MINOR;
            default -> PATCH;
        };
    }
}
