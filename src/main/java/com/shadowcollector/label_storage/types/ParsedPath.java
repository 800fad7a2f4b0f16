package com.shadowcollector.label_storage.types;

/**
 * Segments of an existing key. Optional fields are {@code null} when the layout does not carry them.
 */
public record ParsedPath(String type,
                         String date,
                         String category1,
                         String category2,
                         String taskId,
                         String filename) {

    public static ParsedPath empty() {
        return new ParsedPath("", "", null, null, null, "");
    }
}
