package com.raditha.cocotb.cli;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where the rewritten text of a changed file goes.
 */
public enum OutputPlacement {
    /** Overwrite the original file. */
    IN_PLACE,
    /** Write {@code name.migrated.py} next to {@code name.py}. */
    SIDE_BY_SIDE,
    /** Write nothing. */
    REPORT_ONLY;

    public static final String MIGRATED_SUFFIX = ".migrated.py";

    /**
     * The file to write for {@code source}, or empty for {@link #REPORT_ONLY}.
     */
    public Optional<Path> target(Path source) {
        return switch (this) {
            case IN_PLACE -> Optional.of(source);
            case SIDE_BY_SIDE -> Optional.of(sideBySide(source));
            case REPORT_ONLY -> Optional.empty();
        };
    }

    static Path sideBySide(Path source) {
        String name = source.getFileName().toString();
        String base = name.endsWith(".py") ? name.substring(0, name.length() - 3) : name;
        return source.resolveSibling(base + MIGRATED_SUFFIX);
    }
}
