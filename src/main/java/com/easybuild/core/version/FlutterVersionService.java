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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version handling for Flutter projects: the {@code version:} line of {@code pubspec.yaml}.
 */
@Service
public class FlutterVersionService implements VersionService {

    private static final Logger log = LoggerFactory.getLogger(FlutterVersionService.class);

    /** Matches {@code version: 1.0.0} or {@code version: 1.0.0+5} at the start of a line. */
    static final Pattern VERSION_READ = Pattern.compile(
            "^version:\\s+(\\d+\\.\\d+\\.\\d+(?:\\+\\d+)?)[^\\r\\n]*$", Pattern.MULTILINE);

    static final Pattern VERSION_LINE = Pattern.compile(
            "^version:\\s+\\d+\\.\\d+\\.\\d+[^\\r\\n]*$", Pattern.MULTILINE);

    @Override
    public ProjectType supportedType() {
        return ProjectType.FLUTTER;
    }

    @Override
    public VersionLookup getCurrentVersion(Project project) {
        var pubspec = project.descriptorPath();
        if (!Files.isRegularFile(pubspec)) {
            return VersionLookup.notFound("Project file not found: " + pubspec);
        }
        try {
            Matcher matcher = VERSION_READ.matcher(Files.readString(pubspec));
            if (matcher.find()) {
                return VersionLookup.found(matcher.group(1), project.projectFilePath());
            }
            return VersionLookup.notFound("No version line in " + project.projectFilePath());
        } catch (IOException e) {
            log.error("Could not read {}", pubspec, e);
            return VersionLookup.notFound("Could not read %s: %s".formatted(pubspec, e.getMessage()));
        }
    }

    @Override
    public VersionUpdate updateVersion(Project project, String newVersion) {
        var pubspec = project.descriptorPath();
        if (!Files.isRegularFile(pubspec)) {
            return VersionUpdate.failed("Project file not found: " + pubspec);
        }
        try {
            String content = Files.readString(pubspec);
            Matcher matcher = VERSION_LINE.matcher(content);
            if (!matcher.find()) {
                return VersionUpdate.failed("No version line found in " + project.projectFilePath()
                        + ". " + expectedVersionLocation());
            }
            String updated = matcher.replaceFirst(Matcher.quoteReplacement("version: " + newVersion));
            if (!updated.equals(content)) {
                Files.writeString(pubspec, updated);
            }
            log.info("Set version {} in {}", newVersion, pubspec);
            return VersionUpdate.succeeded("Version updated to %s in %s".formatted(newVersion, project.projectFilePath()));
        } catch (IOException e) {
            log.error("Could not update version in {}", pubspec, e);
            return VersionUpdate.failed("Error while updating version: " + e.getMessage());
        }
    }

    @Override
    public String expectedVersionLocation() {
        return "pubspec.yaml must contain a line such as 'version: 1.2.3' or 'version: 1.2.3+4'.";
    }
}
