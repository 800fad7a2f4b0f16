/**
 * Resolves annotation labels to category directories
 *
 * Features:
 * - Exact lookup in the classes table first
 * - Falls back to the three digit label prefix with a 未分类 second level
 * - Returns the flat 未分类/ marker only when no label is recognised
 * - Drops the 未分类 placeholder of a category1 once a specific category2 exists for it
 * - Groups results by category1 in first-seen order, then deduplicates
 */

package com.shadowcollector.label_storage.category;

import com.shadowcollector.label_storage.types.CategoryInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class CategoryResolver {

    private static final Logger logger = LoggerFactory.getLogger(CategoryResolver.class);

    enum Source {
        CSV,
        PREFIX,
        UNKNOWN
    }

    record Resolution(String label, CategoryInfo category, Source source) {
    }

    private final CategoryTable categoryTable;
    private final PrefixTable prefixTable;

    public CategoryResolver(CategoryTable categoryTable, PrefixTable prefixTable) {
        this.categoryTable = categoryTable;
        this.prefixTable = prefixTable;
    }

    /**
     * Resolves every label and applies the filtering rules.
     *
     * @param labels labels in the order they were extracted
     * @return distinct categories grouped by category1, groups in order of first appearance, empty only for empty input
     */
    public List<CategoryInfo> resolve(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return List.of();
        }

        List<Resolution> resolutions = new ArrayList<>(labels.size());
        for (String label : labels) {
            Resolution resolution = resolveLabel(label);
            logResolution(resolution);
            resolutions.add(resolution);
        }

        boolean allUnknown = resolutions.stream().allMatch(r -> r.source() == Source.UNKNOWN);
        if (allUnknown) {
            return List.of(CategoryInfo.FLAT_UNCLASSIFIED);
        }

        Map<String, List<Resolution>> byCategory1 = new LinkedHashMap<>();
        Set<String> category1WithSpecific = new HashSet<>();
        for (Resolution resolution : resolutions) {
            if (resolution.source() == Source.UNKNOWN) {
                continue;
            }
            String category1 = resolution.category().category1();
            byCategory1.computeIfAbsent(category1, key -> new ArrayList<>()).add(resolution);
            if (resolution.source() == Source.CSV) {
                category1WithSpecific.add(category1);
            }
        }

        Set<CategoryInfo> categories = new LinkedHashSet<>();
        byCategory1.forEach((category1, group) -> {
            boolean hasSpecific = category1WithSpecific.contains(category1);
            for (Resolution resolution : group) {
                CategoryInfo category = resolution.category();
                // any 未分类 second level yields to a specific category2 of the same category1
                if (hasSpecific && CategoryInfo.UNCLASSIFIED.equals(category.category2())) {
                    continue;
                }
                categories.add(category);
            }
        });

        List<CategoryInfo> result = List.copyOf(categories);
        if (logger.isDebugEnabled()) {
            logger.debug("Resolved category paths: {}",
                result.stream().map(CategoryInfo::toString).collect(Collectors.joining(", ")));
        }
        return result;
    }

    /**
     * Category used when a pair has to land in exactly one directory.
     * No labels, or no resolvable category, yields the two-level {@code 未分类/未分类}.
     */
    public CategoryInfo primaryCategory(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return CategoryInfo.UNCATEGORIZED;
        }
        List<CategoryInfo> categories = resolve(labels);
        return categories.isEmpty() ? CategoryInfo.UNCATEGORIZED : categories.get(0);
    }

    public Optional<CategoryInfo> lookup(String label) {
        return categoryTable.lookup(label);
    }

    public static Optional<String> extractPrefix(String label) {
        return PrefixTable.extractPrefix(label);
    }

    public Optional<String> category1ForPrefix(String prefix) {
        return prefixTable.category1ForPrefix(prefix);
    }

    Resolution resolveLabel(String label) {
        Optional<CategoryInfo> exact = categoryTable.lookup(label);
        if (exact.isPresent()) {
            return new Resolution(label, exact.get(), Source.CSV);
        }
        Optional<String> category1 = prefixTable.category1ForLabel(label);
        if (category1.isPresent()) {
            return new Resolution(label, new CategoryInfo(category1.get(), CategoryInfo.UNCLASSIFIED), Source.PREFIX);
        }
        return new Resolution(label, null, Source.UNKNOWN);
    }

    private void logResolution(Resolution resolution) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        switch (resolution.source()) {
            case CSV:
                logger.debug("Label '{}' -> {} (classes table)", resolution.label(), resolution.category());
                break;
            case PREFIX:
                logger.debug("Label '{}' -> {} (prefix fallback)", resolution.label(), resolution.category());
                break;
            default:
                logger.debug("Label '{}' not recognised", resolution.label());
        }
    }
}
