package com.shadowcollector.label_storage.types;

import java.util.Objects;

/**
 * Two-level classification resolved from annotation labels.
 * An empty {@code category2} denotes a single-level directory.
 */
public record CategoryInfo(String category1, String category2) {

    public static final String UNCLASSIFIED = "未分类";

    /** Flat fallback used by the write path: {@code 未分类/} with no second level. */
    public static final CategoryInfo FLAT_UNCLASSIFIED = new CategoryInfo(UNCLASSIFIED, "");

    /** Two-level fallback used by the migration path: {@code 未分类/未分类}. */
    public static final CategoryInfo UNCATEGORIZED = new CategoryInfo(UNCLASSIFIED, UNCLASSIFIED);

    public CategoryInfo {
        category1 = Objects.requireNonNullElse(category1, "");
        category2 = Objects.requireNonNullElse(category2, "");
    }

    public boolean isFlat() {
        return category2.isEmpty();
    }

    public boolean isUnclassified() {
        return UNCLASSIFIED.equals(category1);
    }

    /** Directory fragment below the month segment, e.g. {@code 设备-输电/杆塔} or {@code 未分类}. */
    public String toPathFragment() {
        return isFlat() ? category1 : category1 + "/" + category2;
    }

    @Override
    public String toString() {
        return isFlat() ? category1 + "/" : toPathFragment();
    }
}
