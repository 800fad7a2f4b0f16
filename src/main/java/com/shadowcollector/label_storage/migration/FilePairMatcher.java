/**
 * Pairs image objects with their metadata JSON
 *
 * Features:
 * - Splits listings into image keys and JSON keys by extension
 * - Tries the sibling stem companion first, then the double extension companion
 * - Leaves images without a companion out of the result
 * - Pairs over decoded keys while keeping the literal keys of encoded root objects
 */

package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.FilePair;
import com.shadowcollector.label_storage.types.ObjectEntry;
import com.shadowcollector.label_storage.util.S3Paths;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

public final class FilePairMatcher {

    private FilePairMatcher() {
        // Utility class
    }

    public record SeparatedKeys(List<String> images, List<String> jsons) {
    }

    /**
     * Image keys by recognised extension (case-insensitive), JSON keys by {@code .json}. Other keys are dropped.
     */
    public static SeparatedKeys separate(List<ObjectEntry> entries) {
        List<String> images = new ArrayList<>();
        List<String> jsons = new ArrayList<>();
        if (entries == null) {
            return new SeparatedKeys(images, jsons);
        }
        for (ObjectEntry entry : entries) {
            String key = entry.key();
            if (S3Paths.isJsonKey(key)) {
                jsons.add(key);
            } else if (S3Paths.isImageKey(key)) {
                images.add(key);
            }
        }
        return new SeparatedKeys(images, jsons);
    }

    public static List<FilePair> matchPairs(List<String> images, List<String> jsons) {
        Set<String> jsonKeys = new HashSet<>(jsons);
        List<FilePair> pairs = new ArrayList<>();
        for (String image : images) {
            String companion = findCompanion(image, jsonKeys::contains);
            if (companion != null) {
                pairs.add(new FilePair(image, companion));
            }
        }
        return pairs;
    }

    /**
     * Same matching as {@link #matchPairs} over the entries' decoded keys. Literal keys of encoded
     * root objects are carried into the pair so reads can still find them.
     */
    public static List<FilePair> pairEntries(List<ObjectEntry> entries) {
        Map<String, ObjectEntry> jsonsByKey = new LinkedHashMap<>();
        List<ObjectEntry> images = new ArrayList<>();
        for (ObjectEntry entry : entries) {
            if (S3Paths.isJsonKey(entry.key())) {
                jsonsByKey.put(entry.key(), entry);
            } else if (S3Paths.isImageKey(entry.key())) {
                images.add(entry);
            }
        }

        List<FilePair> pairs = new ArrayList<>();
        for (ObjectEntry image : images) {
            String companion = findCompanion(image.key(), jsonsByKey::containsKey);
            if (companion == null) {
                continue;
            }
            ObjectEntry json = jsonsByKey.get(companion);
            pairs.add(new FilePair(image.key(), json.key(), image.originalKey(), json.originalKey()));
        }
        return pairs;
    }

    /**
     * Replaces percent-encoded root entries by their decoded form, keeping the literal key as {@code originalKey}.
     */
    public static List<ObjectEntry> normalizeEntries(List<ObjectEntry> entries) {
        List<ObjectEntry> normalized = new ArrayList<>(entries.size());
        for (ObjectEntry entry : entries) {
            if (entry.originalKey() == null && PathGrammar.isUrlEncodedRoot(entry.key())) {
                normalized.add(entry.withDecodedKey(PathGrammar.decodeRootKey(entry.key())));
            } else {
                normalized.add(entry);
            }
        }
        return normalized;
    }

    private static String findCompanion(String imageKey, Predicate<String> present) {
        String stemCompanion = S3Paths.stripExtension(imageKey) + ".json";
        if (present.test(stemCompanion)) {
            return stemCompanion;
        }
        String doubleExtensionCompanion = imageKey + ".json";
        if (present.test(doubleExtensionCompanion)) {
            return doubleExtensionCompanion;
        }
        return null;
    }
}
