package com.easybuild.core.version;

import com.easybuild.core.model.PlatformDescriptor;
import com.easybuild.core.model.PlatformKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds Xamarin platform projects ({@code *.Android.csproj}, {@code *.iOS.csproj}, ...)
 * anywhere under a working copy.
 *
 * <p>The walk is depth-first and visits the entries of each directory sorted by name,
 * so the discovery order is the same on every file system. Hidden directories
 * ({@code .git}, {@code .vs}, ...) are not entered.
 */
@Component
public class PlatformProjectLocator {

    private static final Logger log = LoggerFactory.getLogger(PlatformProjectLocator.class);

    /**
     * Lists every platform project under {@code root} in walk order.
     *
     * @throws IOException if a directory cannot be listed
     */
    public List<PlatformDescriptor> discover(Path root) throws IOException {
        var found = new ArrayList<PlatformDescriptor>();
        if (!Files.isDirectory(root)) {
            return found;
        }
        walk(root, root, found);
        log.info("Found {} platform project(s) under {}", found.size(), root);
        return found;
    }

    private void walk(Path root, Path dir, List<PlatformDescriptor> found) throws IOException {
        List<Path> entries;
        try (Stream<Path> listing = Files.list(dir)) {
            entries = listing.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry)) {
                if (!name.startsWith(".")) {
                    walk(root, entry, found);
                }
            } else if (Files.isRegularFile(entry)) {
                PlatformKind.fromFileName(name).ifPresent(kind -> {
                    log.debug("Platform project {} ({})", root.relativize(entry), kind);
                    found.add(new PlatformDescriptor(entry, root.relativize(entry), kind));
                });
            }
        }
    }
}
