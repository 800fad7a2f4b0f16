package com.shadowcollector.label_storage.types;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operating modes of a migration run. List modes never mutate storage.
 */
public enum MigrationMode {
    /** Migrate every pair found in a previously exported object listing. */
    BULK_LISTING("bulk", false),
    /** Scan the bucket live and migrate every non-compliant pair. */
    SCAN_ALL("scan-all", false),
    /** Re-resolve pairs parked under {@code 未分类/未分类}. */
    RECLASSIFY("reclassify", false),
    LIST_UNCATEGORIZED("list-uncategorized", true),
    LIST_NON_COMPLIANT("list-non-compliant", true);

    private final String optionValue;
    private final boolean listOnly;

    MigrationMode(String optionValue, boolean listOnly) {
        this.optionValue = optionValue;
        this.listOnly = listOnly;
    }

    public String optionValue() {
        return optionValue;
    }

    public boolean isListOnly() {
        return listOnly;
    }

    public static Optional<MigrationMode> fromOptionValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(mode -> mode.optionValue.equals(normalized))
            .findFirst();
    }
}
