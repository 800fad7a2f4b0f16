/**
 * Scans the bucket live for pairs that need attention
 *
 * Features:
 * - Lists every storage type prefix and keeps keys outside the canonical layout
 * - Lists the bucket root non-recursively for percent-encoded objects
 * - Collects pairs parked under 未分类/未分类 for reclassification
 * - Reports per-prefix counts through an optional progress callback
 */

package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.service.ObjectStore;
import com.shadowcollector.label_storage.types.FilePair;
import com.shadowcollector.label_storage.types.ObjectEntry;
import com.shadowcollector.label_storage.types.PathViolationType;
import com.shadowcollector.label_storage.types.StorageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

public class BucketScanner {

    private static final Logger logger = LoggerFactory.getLogger(BucketScanner.class);

    public static final String UNCATEGORIZED_PATH_MARKER = "未分类/未分类";

    private static final String ROOT_DELIMITER = "/";

    private final ObjectStore objectStore;

    public BucketScanner(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    public List<FilePair> scanNonCompliant() {
        return scanNonCompliant(null);
    }

    /**
     * @param onProgress receives the scanned prefix name and its non-compliant object count, may be {@code null}
     */
    public List<FilePair> scanNonCompliant(BiConsumer<String, Integer> onProgress) {
        List<ObjectEntry> nonCompliant = new ArrayList<>();

        for (StorageType type : StorageType.values()) {
            int found = 0;
            for (ObjectEntry entry : objectStore.list(type.prefix())) {
                if (!PathGrammar.isValid(entry.key())) {
                    nonCompliant.add(entry);
                    found++;
                }
            }
            logger.debug("Scanned {}: found {} non-compliant objects", type.prefix(), found);
            if (onProgress != null) {
                onProgress.accept(type.pathSegment(), found);
            }
        }

        List<ObjectEntry> encoded = scanRootForEncodedKeys();
        if (!encoded.isEmpty()) {
            nonCompliant.addAll(encoded);
            if (onProgress != null) {
                onProgress.accept(PathViolationType.URL_ENCODED_ROOT.wireName(), encoded.size());
            }
        }

        List<FilePair> pairs = FilePairMatcher.pairEntries(nonCompliant);
        logger.info("Found {} non-compliant file pairs from {} objects", pairs.size(), nonCompliant.size());
        return pairs;
    }

    /**
     * Root level objects whose key is a whole percent-encoded path, decoded with the literal key kept.
     */
    public List<ObjectEntry> scanRootForEncodedKeys() {
        List<ObjectEntry> encoded = new ArrayList<>();
        for (ObjectEntry entry : objectStore.list("", ROOT_DELIMITER)) {
            if (PathGrammar.isUrlEncodedRoot(entry.key())) {
                encoded.add(entry.withDecodedKey(PathGrammar.decodeRootKey(entry.key())));
            }
        }
        return encoded;
    }

    public List<FilePair> scanUncategorized() {
        List<ObjectEntry> uncategorized = new ArrayList<>();
        for (StorageType type : StorageType.values()) {
            for (ObjectEntry entry : objectStore.list(type.prefix())) {
                if (isUncategorizedPath(entry.key())) {
                    uncategorized.add(entry);
                }
            }
        }
        List<FilePair> pairs = FilePairMatcher.pairEntries(uncategorized);
        logger.info("Found {} uncategorized file pairs", pairs.size());
        return pairs;
    }

    public static boolean isUncategorizedPath(String key) {
        return key != null && key.contains(UNCATEGORIZED_PATH_MARKER);
    }
}
