package com.easybuild.core.version;

import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import com.easybuild.core.model.VersionLookup;
import com.easybuild.core.model.VersionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Version handling for .NET MAUI projects.
 *
 * <p>A MAUI {@code .csproj} carries two independent fields: the user-facing
 * {@code ApplicationDisplayVersion} and the integer build counter {@code ApplicationVersion}
 * that the stores require to grow with every upload. Setting a display version always
 * bumps the build counter by one as well.
 */
@Service
public class DotNetMauiVersionService implements VersionService {

    private static final Logger log = LoggerFactory.getLogger(DotNetMauiVersionService.class);

    static final String DISPLAY_VERSION_TAG = "ApplicationDisplayVersion";
    static final String BUILD_COUNTER_TAG = "ApplicationVersion";

    /** Base used when the existing build counter is not an integer. */
    private static final int DEFAULT_BUILD_COUNTER = 1;

    @Override
    public ProjectType supportedType() {
        return ProjectType.DOTNET_MAUI;
    }

    @Override
    public VersionLookup getCurrentVersion(Project project) {
        var csproj = project.descriptorPath();
        if (!Files.isRegularFile(csproj)) {
            return VersionLookup.notFound("Project file not found: " + csproj);
        }
        try {
            return CsprojDocument.parse(csproj).propertyValue(DISPLAY_VERSION_TAG)
                    .map(v -> VersionLookup.found(v, project.projectFilePath()))
                    .orElseGet(() -> VersionLookup.notFound(
                            "No %s in %s".formatted(DISPLAY_VERSION_TAG, project.projectFilePath())));
        } catch (IOException e) {
            log.error("Could not read {}", csproj, e);
            return VersionLookup.notFound("Could not read %s: %s".formatted(csproj, e.getMessage()));
        }
    }

    @Override
    public VersionUpdate updateVersion(Project project, String newVersion) {
        var csproj = project.descriptorPath();
        if (!Files.isRegularFile(csproj)) {
            return VersionUpdate.failed("Project file not found: " + csproj);
        }
        try {
            var document = CsprojDocument.parse(csproj);
            if (!document.hasProperty(DISPLAY_VERSION_TAG)) {
                return VersionUpdate.failed("No %s field in %s. %s".formatted(
                        DISPLAY_VERSION_TAG, project.projectFilePath(), expectedVersionLocation()));
            }

            var text = DescriptorText.read(csproj);
            var display = XmlTagEditor.replaceAll(text.content(), DISPLAY_VERSION_TAG, newVersion);
            if (!display.changed()) {
                return VersionUpdate.failed("No editable %s element in %s".formatted(
                        DISPLAY_VERSION_TAG, project.projectFilePath()));
            }

            String content = display.content();
            String counterNote = "";
            if (document.hasProperty(BUILD_COUNTER_TAG)) {
                int current = parseCounter(document.propertyValue(BUILD_COUNTER_TAG));
                int next;
                try {
                    next = Math.addExact(current, 1);
                } catch (ArithmeticException e) {
                    return VersionUpdate.failed("%s %d in %s cannot be incremented".formatted(
                            BUILD_COUNTER_TAG, current, project.projectFilePath()));
                }
                var counter = XmlTagEditor.replaceAll(content, BUILD_COUNTER_TAG, Integer.toString(next));
                if (counter.changed()) {
                    content = counter.content();
                    counterNote = " (%s: %d -> %d)".formatted(BUILD_COUNTER_TAG, current, next);
                }
            } else {
                log.warn("{} has no {}; build counter left unchanged", csproj, BUILD_COUNTER_TAG);
            }

            text.withContent(content).write(csproj);
            log.info("Set {} {} in {}{}", DISPLAY_VERSION_TAG, newVersion, csproj, counterNote);
            return VersionUpdate.succeeded("Version updated to %s in %s%s".formatted(
                    newVersion, project.projectFilePath(), counterNote));
        } catch (IOException e) {
            log.error("Could not update version in {}", csproj, e);
            return VersionUpdate.failed("Error while updating version: " + e.getMessage());
        }
    }

    @Override
    public String expectedVersionLocation() {
        return "The .csproj must declare <ApplicationDisplayVersion>X.Y.Z</ApplicationDisplayVersion> "
                + "and <ApplicationVersion>N</ApplicationVersion> inside a <PropertyGroup>.";
    }

    private static int parseCounter(Optional<String> raw) {
        if (raw.isEmpty()) {
            return DEFAULT_BUILD_COUNTER;
        }
        try {
            return Integer.parseInt(raw.get().strip());
        } catch (NumberFormatException e) {
            log.warn("{} '{}' is not an integer, counting from {}", BUILD_COUNTER_TAG, raw.get(), DEFAULT_BUILD_COUNTER);
            return DEFAULT_BUILD_COUNTER;
        }
    }
}
