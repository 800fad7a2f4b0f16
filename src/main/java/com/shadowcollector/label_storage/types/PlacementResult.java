package com.shadowcollector.label_storage.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keys written by a placement. {@code allPaths} is {@code null} unless more than one category was written.
 */
public record PlacementResult(String primaryPath, String metadataPath, List<PlacedPaths> allPaths) {

    public PlacementResult {
        allPaths = allPaths == null ? null : Collections.unmodifiableList(new ArrayList<>(allPaths));
    }

    public record PlacedPaths(String filePath, String metadataPath, CategoryInfo category) {
    }
}
