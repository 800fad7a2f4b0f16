/**
 * Listing of non-compliant file pairs grouped by violation type
 * Produced by the list-only modes, never mutates storage
 */

package com.shadowcollector.label_storage.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NonCompliantReport {
    private final Map<PathViolationType, List<FilePair>> pairsByViolation;

    public NonCompliantReport(Map<PathViolationType, List<FilePair>> pairsByViolation) {
        Map<PathViolationType, List<FilePair>> copy = new LinkedHashMap<>();
        if (pairsByViolation != null) {
            pairsByViolation.forEach((type, pairs) -> copy.put(type, List.copyOf(pairs)));
        }
        this.pairsByViolation = Collections.unmodifiableMap(copy);
    }

    public static NonCompliantReport empty() {
        return new NonCompliantReport(Collections.emptyMap());
    }

    public Map<PathViolationType, List<FilePair>> getPairsByViolation() {
        return pairsByViolation;
    }

    public List<FilePair> getPairs(PathViolationType type) {
        return pairsByViolation.getOrDefault(type, List.of());
    }

    public int getTotalPairs() {
        return pairsByViolation.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return getTotalPairs() == 0;
    }

    @Override
    public String toString() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        pairsByViolation.forEach((type, pairs) -> counts.put(type.wireName(), pairs.size()));
        return "NonCompliantReport{" + "totalPairs=" + getTotalPairs() + ", byViolation=" + counts + '}';
    }
}
