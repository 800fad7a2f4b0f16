package com.shadowcollector.label_storage.migration;

import com.shadowcollector.label_storage.types.FilePair;
import com.shadowcollector.label_storage.types.ObjectEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FilePairMatcherTest {

    @Test
    void separatesImagesAndJsonByExtension() {
        FilePairMatcher.SeparatedKeys separated = FilePairMatcher.separate(entries(
            "a/1.jpg", "a/2.JPEG", "a/3.png", "a/4.gif", "a/5.webp", "a/6.bmp",
            "a/1.json", "a/x.JSON", "a/readme.txt", "a/noext"));

        assertThat(separated.images()).containsExactly("a/1.jpg", "a/2.JPEG", "a/3.png", "a/4.gif", "a/5.webp", "a/6.bmp");
        assertThat(separated.jsons()).containsExactly("a/1.json", "a/x.JSON");
    }

    @Test
    void pairsStemCompanion() {
        List<FilePair> pairs = FilePairMatcher.matchPairs(List.of("d/img.jpg"), List.of("d/img.json"));

        assertThat(pairs).containsExactly(new FilePair("d/img.jpg", "d/img.json"));
    }

    @Test
    void pairsDoubleExtensionCompanion() {
        List<FilePair> pairs = FilePairMatcher.matchPairs(List.of("d/img.png"), List.of("d/img.png.json"));

        assertThat(pairs).containsExactly(new FilePair("d/img.png", "d/img.png.json"));
    }

    @Test
    @DisplayName("Stem companion wins when both companions exist")
    void prefersStemCompanion() {
        List<FilePair> pairs = FilePairMatcher.matchPairs(
            List.of("d/img.png"), List.of("d/img.png.json", "d/img.json"));

        assertThat(pairs).containsExactly(new FilePair("d/img.png", "d/img.json"));
    }

    @Test
    void imagesWithoutCompanionAreLeftOut() {
        List<FilePair> pairs = FilePairMatcher.matchPairs(
            List.of("d/a.jpg", "d/b.jpg", "e/a.jpg"), List.of("d/a.json", "d/other.json"));

        assertThat(pairs).containsExactly(new FilePair("d/a.jpg", "d/a.json"));
    }

    @Test
    void companionLookupIsCaseSensitive() {
        List<FilePair> pairs = FilePairMatcher.matchPairs(List.of("d/A.jpg"), List.of("d/a.json"));

        assertThat(pairs).isEmpty();
    }

    @Test
    void normalizesEncodedRootEntries() {
        List<ObjectEntry> normalized = FilePairMatcher.normalizeEntries(entries(
            "detection%2F2024-01%2F未分类%2F未分类%2Ffile.jpg",
            "detection/2024-01-02/plain.jpg"));

        assertThat(normalized.get(0).key()).isEqualTo("detection/2024-01/未分类/未分类/file.jpg");
        assertThat(normalized.get(0).originalKey()).isEqualTo("detection%2F2024-01%2F未分类%2F未分类%2Ffile.jpg");
        assertThat(normalized.get(0).storageKey()).isEqualTo("detection%2F2024-01%2F未分类%2F未分类%2Ffile.jpg");
        assertThat(normalized.get(1)).isEqualTo(ObjectEntry.of("detection/2024-01-02/plain.jpg"));
    }

    @Test
    @DisplayName("Encoded pairs match on decoded keys and keep the literal keys")
    void pairEntriesCarriesLiteralKeys() {
        List<ObjectEntry> normalized = FilePairMatcher.normalizeEntries(entries(
            "detection%2F2024-01%2Fx%2Fy%2Ffile.jpg",
            "detection%2F2024-01%2Fx%2Fy%2Ffile.json",
            "classify/2024-01-02/plain.jpg",
            "classify/2024-01-02/plain.json"));

        List<FilePair> pairs = FilePairMatcher.pairEntries(normalized);

        assertThat(pairs).containsExactly(
            new FilePair("detection/2024-01/x/y/file.jpg", "detection/2024-01/x/y/file.json",
                "detection%2F2024-01%2Fx%2Fy%2Ffile.jpg", "detection%2F2024-01%2Fx%2Fy%2Ffile.json"),
            new FilePair("classify/2024-01-02/plain.jpg", "classify/2024-01-02/plain.json"));
        assertThat(pairs.get(0).isEncoded()).isTrue();
        assertThat(pairs.get(0).sourceImagePath()).isEqualTo("detection%2F2024-01%2Fx%2Fy%2Ffile.jpg");
        assertThat(pairs.get(1).isEncoded()).isFalse();
        assertThat(pairs.get(1).sourceJsonPath()).isEqualTo("classify/2024-01-02/plain.json");
    }

    private static List<ObjectEntry> entries(String... keys) {
        return Stream.of(keys).map(ObjectEntry::of).collect(Collectors.toList());
    }
}
