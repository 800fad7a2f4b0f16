package com.shadowcollector.label_storage.category;

import com.shadowcollector.label_storage.types.CategoryInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact label to category mapping, read once at startup. Immutable.
 */
public final class CategoryTable {

    private final Map<String, CategoryInfo> categoriesByLabel;

    public CategoryTable(Map<String, CategoryInfo> categoriesByLabel) {
        this.categoriesByLabel = Collections.unmodifiableMap(new LinkedHashMap<>(categoriesByLabel));
    }

    public Optional<CategoryInfo> lookup(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(categoriesByLabel.get(label));
    }

    public int size() {
        return categoriesByLabel.size();
    }

    public Map<String, CategoryInfo> asMap() {
        return categoriesByLabel;
    }
}
