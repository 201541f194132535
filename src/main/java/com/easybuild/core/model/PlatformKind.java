package com.easybuild.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Target platform of a Xamarin platform project, derived from its file name suffix.
 */
public enum PlatformKind {
    ANDROID("Android", List.of(".Android.csproj", ".Droid.csproj")),
    IOS("iOS", List.of(".iOS.csproj")),
    /** Windows-family projects: discovered, never versioned. */
    OTHER("Windows", List.of(".UWP.csproj", ".WinPhone.csproj"));

    private final String displayName;
    private final List<String> suffixes;

    PlatformKind(String displayName, List<String> suffixes) {
        this.displayName = displayName;
        this.suffixes = suffixes;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> suffixes() {
        return suffixes;
    }

    public boolean isVersioned() {
        return this != OTHER;
    }

    /**
     * Matches a file name against the known platform suffixes, ignoring case.
     */
    public static Optional<PlatformKind> fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (PlatformKind kind : values()) {
            for (String suffix : kind.suffixes) {
                if (lower.endsWith(suffix.toLowerCase(Locale.ROOT))) {
                    return Optional.of(kind);
                }
            }
        }
        return Optional.empty();
    }
}
