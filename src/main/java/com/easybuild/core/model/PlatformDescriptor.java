package com.easybuild.core.model;

import java.nio.file.Path;

/**
 * A Xamarin platform project found under a working copy.
 *
 * @param path         absolute file location
 * @param relativePath location relative to the working copy root, used in messages
 * @param kind         platform derived from the file name
 */
public record PlatformDescriptor(
    Path path,
    Path relativePath,
    PlatformKind kind
) {}
