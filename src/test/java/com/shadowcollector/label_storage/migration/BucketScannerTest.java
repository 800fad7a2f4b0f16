package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.testutil.InMemoryObjectStore;
import com.shadowcollector.label_storage.types.FilePair;
import com.shadowcollector.label_storage.types.ObjectEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BucketScannerTest {

    private InMemoryObjectStore store;
    private BucketScanner scanner;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore()
            .with("detection/2024-03/设备-输电/杆塔/ok.jpg", "img")
            .with("detection/2024-03/设备-输电/杆塔/ok.json", "{}")
            .with("detection/2024-03-15/flat.jpg", "img")
            .with("detection/2024-03-15/flat.json", "{}")
            .with("classify/2026-01-22/0123456789abcdef0123456789abcdef/task.png", "img")
            .with("classify/2026-01-22/0123456789abcdef0123456789abcdef/task.png.json", "{}")
            .with("classify/2025-01/未分类/未分类/parked.jpg", "img")
            .with("classify/2025-01/未分类/未分类/parked.json", "{}")
            .with("detection%2F2024-01%2F未分类%2F未分类%2Froot.jpg", "img")
            .with("detection%2F2024-01%2F未分类%2F未分类%2Froot.json", "{}")
            .with("unrelated/2024-01-01/x.jpg", "img")
            .with("unrelated/2024-01-01/x.json", "{}")
            .with("notes.txt", "n");
        scanner = new BucketScanner(store);
    }

    @Test
    void findsPairsOutsideCanonicalLayout() {
        List<FilePair> pairs = scanner.scanNonCompliant();

        assertThat(pairs).extracting(FilePair::imagePath).containsExactlyInAnyOrder(
            "detection/2024-03-15/flat.jpg",
            "classify/2026-01-22/0123456789abcdef0123456789abcdef/task.png",
            "detection/2024-01/未分类/未分类/root.jpg");
    }

    @Test
    void encodedRootPairKeepsLiteralKeys() {
        FilePair encoded = scanner.scanNonCompliant().stream()
            .filter(FilePair::isEncoded)
            .findFirst()
            .orElseThrow();

        assertThat(encoded.sourceImagePath()).isEqualTo("detection%2F2024-01%2F未分类%2F未分类%2Froot.jpg");
        assertThat(encoded.sourceJsonPath()).isEqualTo("detection%2F2024-01%2F未分类%2F未分类%2Froot.json");
        assertThat(encoded.jsonPath()).isEqualTo("detection/2024-01/未分类/未分类/root.json");
    }

    @Test
    void reportsProgressPerPrefix() {
        Map<String, Integer> progress = new LinkedHashMap<>();

        scanner.scanNonCompliant(progress::put);

        assertThat(progress).containsExactly(
            entry("detection", 2),
            entry("multimodal", 0),
            entry("text-qa", 0),
            entry("classify", 2),
            entry("qa-pair", 0),
            entry("url-encoded-root", 2));
    }

    @Test
    void rootScanOnlyReturnsEncodedKeys() {
        List<ObjectEntry> encoded = scanner.scanRootForEncodedKeys();

        assertThat(encoded).extracting(ObjectEntry::key).containsExactly(
            "detection/2024-01/未分类/未分类/root.jpg",
            "detection/2024-01/未分类/未分类/root.json");
    }

    @Test
    void findsUncategorizedPairs() {
        List<FilePair> pairs = scanner.scanUncategorized();

        assertThat(pairs).containsExactly(
            new FilePair("classify/2025-01/未分类/未分类/parked.jpg", "classify/2025-01/未分类/未分类/parked.json"));
    }

    @Test
    void uncategorizedMarkerMatchesAnywhereInKey() {
        assertThat(BucketScanner.isUncategorizedPath("detection/2024-01/未分类/未分类/a.jpg")).isTrue();
        assertThat(BucketScanner.isUncategorizedPath("detection/2024-01/未分类/a.jpg")).isFalse();
        assertThat(BucketScanner.isUncategorizedPath(null)).isFalse();
    }

    @Test
    void emptyBucketHasNothingToReport() {
        BucketScanner emptyScanner = new BucketScanner(new InMemoryObjectStore());

        assertThat(emptyScanner.scanNonCompliant()).isEmpty();
        assertThat(emptyScanner.scanUncategorized()).isEmpty();
    }
}
