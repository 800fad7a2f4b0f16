package com.shadowcollector.label_storage.types;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for a single migration run. {@code objectListPath} is only consulted in {@link MigrationMode#BULK_LISTING}.
 */
public record MigrationOptions(MigrationMode mode, boolean dryRun, Path objectListPath) {

    public MigrationOptions {
        Objects.requireNonNull(mode, "mode");
    }

    public static MigrationOptions of(MigrationMode mode, boolean dryRun) {
        return new MigrationOptions(mode, dryRun, null);
    }

    public static MigrationOptions bulk(Path objectListPath, boolean dryRun) {
        return new MigrationOptions(MigrationMode.BULK_LISTING, dryRun, objectListPath);
    }
}
