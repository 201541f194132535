package com.easybuild.core.version;

import com.easybuild.core.model.PlatformDescriptor;
import com.easybuild.core.model.PlatformKind;
import com.easybuild.core.model.PlatformUpdateOutcome;
import com.easybuild.core.model.PlatformUpdateOutcome.Status;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import com.easybuild.core.model.VersionLookup;
import com.easybuild.core.model.VersionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Version handling for Xamarin solutions.
 *
 * <p>A Xamarin solution keeps one project per platform, and each platform stores its
 * version under different tags:
 * <ul>
 *   <li>Android: {@code ApplicationVersion} plus the numeric {@code AndroidVersionCode}</li>
 *   <li>iOS: {@code ApplicationVersion}, {@code CFBundleVersion} and
 *       {@code CFBundleShortVersionString}</li>
 * </ul>
 * Windows-family projects are discovered but not versioned.
 *
 * <p>Every discovered file is updated independently. The update succeeds when at least
 * one file was written, so a solution without an iOS project releases normally.
 */
@Service
public class XamarinVersionService implements VersionService {

    private static final Logger log = LoggerFactory.getLogger(XamarinVersionService.class);

    static final String APPLICATION_VERSION = "ApplicationVersion";
    static final String ANDROID_VERSION_CODE = "AndroidVersionCode";
    static final String CF_BUNDLE_VERSION = "CFBundleVersion";
    static final String CF_BUNDLE_SHORT_VERSION = "CFBundleShortVersionString";

    private static final String BULLET = "\n  • ";

    private final PlatformProjectLocator locator;

    public XamarinVersionService(PlatformProjectLocator locator) {
        this.locator = locator;
    }

    @Override
    public ProjectType supportedType() {
        return ProjectType.XAMARIN;
    }

    @Override
    public VersionLookup getCurrentVersion(Project project) {
        List<PlatformDescriptor> descriptors;
        try {
            descriptors = locator.discover(project.repoPath());
        } catch (IOException e) {
            log.error("Could not search {} for platform projects", project.repoPath(), e);
            return VersionLookup.notFound("Could not search %s: %s".formatted(project.repoPath(), e.getMessage()));
        }
        if (descriptors.isEmpty()) {
            log.warn("No platform projects (*.Android.csproj, *.iOS.csproj) in {}", project.repoPath());
            return VersionLookup.notFound(
                    "No Xamarin platform projects (*.Android.csproj, *.Droid.csproj, *.iOS.csproj) found in "
                            + project.repoPath());
        }

        for (PlatformDescriptor descriptor : descriptors) {
            Optional<String> version = readVersion(descriptor);
            if (version.isPresent()) {
                log.info("Version {} found in {}", version.get(), descriptor.relativePath());
                return VersionLookup.found(version.get(), descriptor.relativePath().toString());
            }
        }

        String platforms = descriptors.stream()
                .map(PlatformDescriptor::kind)
                .filter(PlatformKind::isVersioned)
                .distinct()
                .map(PlatformKind::displayName)
                .collect(Collectors.joining(", "));
        if (platforms.isEmpty()) {
            return VersionLookup.notFound("Only Windows platform projects found; no Android or iOS project in "
                    + project.repoPath());
        }
        log.warn("Platform projects found ({}) but none declares a version", platforms);
        return VersionLookup.notFound("Platform projects found (%s) but none declares a version. %s"
                .formatted(platforms, expectedVersionLocation()));
    }

    @Override
    public VersionUpdate updateVersion(Project project, String newVersion) {
        List<PlatformDescriptor> descriptors;
        try {
            descriptors = locator.discover(project.repoPath());
        } catch (IOException e) {
            log.error("Could not search {} for platform projects", project.repoPath(), e);
            return VersionUpdate.failed("Could not search %s: %s".formatted(project.repoPath(), e.getMessage()));
        }
        if (descriptors.isEmpty()) {
            return VersionUpdate.failed("""
                    No Xamarin platform projects found.
                    Make sure the solution contains:
                      - for Android: *.Android.csproj or *.Droid.csproj
                      - for iOS: *.iOS.csproj""");
        }

        var outcomes = new ArrayList<PlatformUpdateOutcome>();
        for (PlatformDescriptor descriptor : descriptors) {
            PlatformUpdateOutcome outcome = updateFile(descriptor, newVersion);
            switch (outcome.status()) {
                case UPDATED -> log.info("Updated {}: {}", descriptor.relativePath(), outcome.detail());
                case SKIPPED -> log.info("Skipped {}: {}", descriptor.relativePath(), outcome.detail());
                case FAILED -> log.error("Could not update {}: {}", descriptor.relativePath(), outcome.detail());
            }
            outcomes.add(outcome);
        }

        boolean anyUpdated = outcomes.stream().anyMatch(PlatformUpdateOutcome::success);
        return new VersionUpdate(anyUpdated, summarize(newVersion, outcomes), outcomes);
    }

    @Override
    public String expectedVersionLocation() {
        return "Platform projects must declare: for Android <ApplicationVersion>X.Y.Z</ApplicationVersion> "
                + "and <AndroidVersionCode>N</AndroidVersionCode>; for iOS <ApplicationVersion>X.Y.Z</ApplicationVersion> "
                + "and <CFBundleVersion>X.Y.Z</CFBundleVersion>.";
    }

    private Optional<String> readVersion(PlatformDescriptor descriptor) {
        if (!descriptor.kind().isVersioned()) {
            return Optional.empty();
        }
        try {
            var document = CsprojDocument.parse(descriptor.path());
            Optional<String> version = document.propertyValue(APPLICATION_VERSION);
            if (version.isEmpty() && descriptor.kind() == PlatformKind.IOS) {
                version = document.propertyValue(CF_BUNDLE_SHORT_VERSION);
            }
            return version;
        } catch (IOException e) {
            log.error("Could not read version from {}", descriptor.path(), e);
            return Optional.empty();
        }
    }

    private PlatformUpdateOutcome updateFile(PlatformDescriptor descriptor, String newVersion) {
        var relative = descriptor.relativePath();
        var kind = descriptor.kind();
        if (!kind.isVersioned()) {
            return new PlatformUpdateOutcome(relative, kind, Status.SKIPPED,
                    "not an Android or iOS project");
        }

        try {
            // parsed view decides which tags exist; comments are not elements
            var document = CsprojDocument.parse(descriptor.path());
            var text = DescriptorText.read(descriptor.path());

            var updatedTags = new ArrayList<String>();
            var warnings = new ArrayList<String>();
            String content = text.content();

            for (String tag : primaryTags(kind)) {
                if (!document.hasProperty(tag)) {
                    continue;
                }
                var edit = XmlTagEditor.replaceAll(content, tag, newVersion);
                if (edit.changed()) {
                    content = edit.content();
                    updatedTags.add(tag);
                }
            }

            if (kind == PlatformKind.ANDROID && document.hasProperty(ANDROID_VERSION_CODE)) {
                var triplet = VersionNumbers.parseExact(newVersion);
                if (triplet.isPresent()) {
                    try {
                        var edit = XmlTagEditor.replaceAll(content, ANDROID_VERSION_CODE,
                                Integer.toString(triplet.get().androidVersionCode()));
                        content = edit.content();
                        updatedTags.add(ANDROID_VERSION_CODE);
                    } catch (ArithmeticException e) {
                        log.warn("{} for version '{}' in {} is out of range", ANDROID_VERSION_CODE, newVersion, relative);
                        warnings.add("%s not changed: version code for '%s' is out of range"
                                .formatted(ANDROID_VERSION_CODE, newVersion));
                    }
                } else {
                    log.warn("Cannot derive {} from version '{}' in {}", ANDROID_VERSION_CODE, newVersion, relative);
                    warnings.add("%s not changed: '%s' is not MAJOR.MINOR.PATCH".formatted(ANDROID_VERSION_CODE, newVersion));
                }
            }

            if (updatedTags.isEmpty()) {
                return new PlatformUpdateOutcome(relative, kind, Status.FAILED,
                        "no version tags for %s found".formatted(kind.displayName()));
            }

            text.withContent(content).write(descriptor.path());
            String detail = "set " + String.join(", ", updatedTags);
            if (!warnings.isEmpty()) {
                detail += " (warning: " + String.join("; ", warnings) + ")";
            }
            return new PlatformUpdateOutcome(relative, kind, Status.UPDATED, detail);
        } catch (IOException e) {
            log.error("Could not update {}", descriptor.path(), e);
            return new PlatformUpdateOutcome(relative, kind, Status.FAILED, e.getMessage());
        }
    }

    private static List<String> primaryTags(PlatformKind kind) {
        return switch (kind) {
            case ANDROID -> List.of(APPLICATION_VERSION);
            case IOS -> List.of(APPLICATION_VERSION, CF_BUNDLE_SHORT_VERSION, CF_BUNDLE_VERSION);
            case OTHER -> List.of();
        };
    }

    private String summarize(String newVersion, List<PlatformUpdateOutcome> outcomes) {
        var updated = outcomes.stream().filter(o -> o.status() == Status.UPDATED).toList();
        var failed = outcomes.stream().filter(o -> o.status() == Status.FAILED).toList();
        var skipped = outcomes.stream().filter(o -> o.status() == Status.SKIPPED).toList();

        var message = new StringBuilder();
        if (!updated.isEmpty() && failed.isEmpty()) {
            message.append("Version updated to ").append(newVersion).append("\n\n");
            message.append("Platforms: ").append(platformCounts(updated)).append("\n\n");
            message.append("Updated files:").append(bullets(updated));
        } else if (!updated.isEmpty()) {
            message.append("Version partially updated to ").append(newVersion).append("\n\n");
            message.append("Updated:").append(bullets(updated)).append("\n\n");
            message.append("Errors:").append(bullets(failed));
        } else {
            message.append("Could not update the version in any file\n\n");
            var missing = missingPlatforms(outcomes);
            if (!missing.isEmpty()) {
                message.append("Platforms not found:").append(BULLET).append(String.join(BULLET, missing)).append("\n\n");
            }
            if (!failed.isEmpty()) {
                message.append("Errors:").append(bullets(failed)).append("\n\n");
            }
            message.append(expectedVersionLocation());
        }
        if (!skipped.isEmpty()) {
            message.append("\n\nSkipped:").append(bullets(skipped));
        }
        return message.toString();
    }

    private static String platformCounts(List<PlatformUpdateOutcome> outcomes) {
        Map<PlatformKind, Long> counts = outcomes.stream()
                .collect(Collectors.groupingBy(PlatformUpdateOutcome::kind,
                        () -> new EnumMap<>(PlatformKind.class), Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> "%s (%d)".formatted(e.getKey().displayName(), e.getValue()))
                .collect(Collectors.joining(", "));
    }

    private static List<String> missingPlatforms(List<PlatformUpdateOutcome> outcomes) {
        var missing = new ArrayList<String>();
        if (outcomes.stream().noneMatch(o -> o.kind() == PlatformKind.ANDROID)) {
            missing.add("Android (*.Android.csproj)");
        }
        if (outcomes.stream().noneMatch(o -> o.kind() == PlatformKind.IOS)) {
            missing.add("iOS (*.iOS.csproj)");
        }
        return missing;
    }

    private static String bullets(List<PlatformUpdateOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> o.file() + ": " + o.detail())
                .collect(Collectors.joining(BULLET, BULLET, ""));
    }
}
