package com.easybuild.core.version;

import com.easybuild.core.model.IncrementType;
import com.easybuild.core.model.Project;
import com.easybuild.core.model.ProjectType;
import com.easybuild.core.model.VersionLookup;
import com.easybuild.core.model.VersionUpdate;

/**
 * Reads and writes the version embedded in a project's build descriptor(s).
 *
 * <p>One implementation per {@link ProjectType}. Implementations report problems
 * through their return values and do not throw for missing files or tags.
 */
public interface VersionService {

    ProjectType supportedType();

    /**
     * Reads the project's current version from its working copy.
     */
    VersionLookup getCurrentVersion(Project project);

    /**
     * Writes {@code newVersion} into the project's descriptor(s).
     */
    VersionUpdate updateVersion(Project project, String newVersion);

    /**
     * Tells the user where this ecosystem keeps its version, for error messages.
     */
    String expectedVersionLocation();

    default String incrementVersion(String version, IncrementType type) {
        return VersionNumbers.increment(version, type);
    }
}
