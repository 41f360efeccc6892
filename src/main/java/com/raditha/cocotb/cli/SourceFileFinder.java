package com.raditha.cocotb.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Collects the Python files to migrate under a path.
 *
 * <p>
 * A regular file is returned as is. A directory is walked recursively for {@code *.py} files,
 * skipping excluded directory names (virtual environments, caches, VCS data) and the
 * {@code *.migrated.py} outputs of earlier runs. Results are sorted.
 */
public class SourceFileFinder {
    private static final Logger logger = LoggerFactory.getLogger(SourceFileFinder.class);

    private final Set<String> excludedDirectories;

    public SourceFileFinder(Collection<String> excludedDirectories) {
        this.excludedDirectories = Set.copyOf(excludedDirectories);
    }

    /**
     * @throws IOException when {@code root} does not exist or cannot be walked
     */
    public List<Path> find(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new IOException("No such file or directory: " + root);
        }
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }

        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && excludedDirectories.contains(dir.getFileName().toString())) {
                    logger.debug("Skipping directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isCandidate(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.naturalOrder());
        logger.info("Found {} Python file(s) under {}", files.size(), root);
        return files;
    }

    static boolean isCandidate(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".py") && !name.endsWith(OutputPlacement.MIGRATED_SUFFIX);
    }
}
