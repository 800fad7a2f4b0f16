package com.shadowcollector.label_storage.types;

import java.util.List;

/**
 * Outcome of {@code MigrationOrchestrator#run}. Migrating modes carry stats; list modes carry the listing.
 */
public record MigrationRunResult(MigrationMode mode,
                                 MigrationStats stats,
                                 NonCompliantReport nonCompliantReport,
                                 List<FilePair> uncategorizedPairs) {

    public static MigrationRunResult migrated(MigrationMode mode, MigrationStats stats) {
        return new MigrationRunResult(mode, stats, null, List.of());
    }

    public static MigrationRunResult nonCompliantListing(NonCompliantReport report) {
        return new MigrationRunResult(MigrationMode.LIST_NON_COMPLIANT, null, report, List.of());
    }

    public static MigrationRunResult uncategorizedListing(List<FilePair> pairs) {
        return new MigrationRunResult(MigrationMode.LIST_UNCATEGORIZED, null, null, List.copyOf(pairs));
    }
}
