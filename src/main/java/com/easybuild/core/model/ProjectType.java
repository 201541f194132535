package com.easybuild.core.model;

import java.util.Locale;

/**
 * Mobile ecosystem a project belongs to. Each one keeps its version in a
 * different descriptor format.
 */
public enum ProjectType {
    FLUTTER("flutter", "Flutter"),
    DOTNET_MAUI("dotnet_maui", ".NET MAUI"),
    XAMARIN("xamarin", "Xamarin");

    private final String value;
    private final String displayName;

    ProjectType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a type from its configuration value ({@code flutter}, {@code dotnet_maui},
     * {@code xamarin}) or its enum name, ignoring case.
     *
     * @throws IllegalArgumentException if the value names no known ecosystem
     */
    public static ProjectType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Project type is empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ProjectType type : values()) {
            if (type.value.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        if ("maui".equals(normalized)) {
            return DOTNET_MAUI;
        }
        throw new IllegalArgumentException("Unknown project type: " + raw);
    }
}
