package com.shadowcollector.label_storage.category;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback mapping from a label's three digit prefix to category1.
 */
public final class PrefixTable {

    private static final Pattern LABEL_PREFIX_PATTERN = Pattern.compile("^(\\d{3})_");

    private static final Map<String, String> DEFAULT_ENTRIES;

    static {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("011", "安监");
        entries.put("021", "设备-输电");
        entries.put("022", "设备-变电");
        entries.put("023", "设备-配电");
        entries.put("031", "营销");
        entries.put("041", "基建");
        DEFAULT_ENTRIES = Collections.unmodifiableMap(entries);
    }

    private final Map<String, String> category1ByPrefix;

    public PrefixTable(Map<String, String> category1ByPrefix) {
        this.category1ByPrefix = Collections.unmodifiableMap(new LinkedHashMap<>(category1ByPrefix));
    }

    public static PrefixTable defaults() {
        return new PrefixTable(DEFAULT_ENTRIES);
    }

    /**
     * Leading three digit code of a label, e.g. {@code "021"} for {@code "021_gt_hd_xs"}.
     */
    public static Optional<String> extractPrefix(String label) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = LABEL_PREFIX_PATTERN.matcher(label);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public Optional<String> category1ForPrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(category1ByPrefix.get(prefix));
    }

    public Optional<String> category1ForLabel(String label) {
        return extractPrefix(label).flatMap(this::category1ForPrefix);
    }

    public int size() {
        return category1ByPrefix.size();
    }
}
