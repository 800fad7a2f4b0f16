package com.shadowcollector.label_storage.types;

/**
 * An image object and its companion metadata JSON.
 * Paths are the decoded keys; the {@code original*} fields are set only for percent-encoded root objects.
 */
public record FilePair(String imagePath,
                       String jsonPath,
                       String originalImagePath,
                       String originalJsonPath) {

    public FilePair(String imagePath, String jsonPath) {
        this(imagePath, jsonPath, null, null);
    }

    public String sourceImagePath() {
        return originalImagePath != null ? originalImagePath : imagePath;
    }

    public String sourceJsonPath() {
        return originalJsonPath != null ? originalJsonPath : jsonPath;
    }

    public boolean isEncoded() {
        return originalImagePath != null;
    }
}
