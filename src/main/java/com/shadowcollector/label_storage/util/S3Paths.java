package com.shadowcollector.label_storage.util;

import java.util.List;
import java.util.Locale;

/**
 * Centralised object key helpers so placement and migration agree on how keys are split.
 */
public final class S3Paths {

    /** Image extensions recognised when pairing listings, lower case and without the dot. */
    public static final List<String> IMAGE_EXTENSIONS = List.of("jpg", "jpeg", "png", "gif", "webp", "bmp");

    public static final String JSON_EXTENSION = "json";

    private S3Paths() {
        // Utility class
    }

    /**
     * Ensure a prefix ends with a single trailing slash so callers can safely
     * concatenate object keys afterwards.
     */
    public static String ensureTrailingSlash(String prefix) {
        return ensureTrailingSlash(prefix, "");
    }

    public static String ensureTrailingSlash(String prefix, String defaultValue) {
        String fallback = defaultValue == null ? "" : defaultValue.trim();
        String base = (prefix == null || prefix.isBlank()) ? fallback : prefix.trim();
        if (base.isEmpty()) {
            return base;
        }
        return base.endsWith("/") ? base : base + "/";
    }

    /** Removes at most one leading slash. */
    public static String stripLeadingSlash(String key) {
        if (key == null) {
            return "";
        }
        return key.startsWith("/") ? key.substring(1) : key;
    }

    /** Last path segment of a key, the whole key when it has no slash. */
    public static String basename(String key) {
        if (key == null) {
            return "";
        }
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    /** Key with its final extension removed, e.g. {@code a/b/img.jpg -> a/b/img}. */
    public static String stripExtension(String key) {
        if (key == null) {
            return "";
        }
        int dot = key.lastIndexOf('.');
        int slash = key.lastIndexOf('/');
        return dot > slash ? key.substring(0, dot) : key;
    }

    /** Lower case extension without the dot, empty when there is none. */
    public static String extension(String key) {
        if (key == null) {
            return "";
        }
        int dot = key.lastIndexOf('.');
        int slash = key.lastIndexOf('/');
        return dot > slash ? key.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isImageKey(String key) {
        return IMAGE_EXTENSIONS.contains(extension(key));
    }

    public static boolean isJsonKey(String key) {
        return JSON_EXTENSION.equals(extension(key));
    }
}
