package com.shadowcollector.label_storage.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One object from a bucket listing.
 * <p>
 * {@code originalKey} is only set for percent-encoded root objects: {@code key} then holds the decoded form used
 * for path arithmetic while {@code originalKey} is the literal stored key needed for reads, copies and deletes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectEntry(String key, String originalKey, Long size, String lastModified) {

    public static ObjectEntry of(String key) {
        return new ObjectEntry(key, null, null, null);
    }

    public ObjectEntry withDecodedKey(String decodedKey) {
        return new ObjectEntry(decodedKey, key, size, lastModified);
    }

    /** Key to use against the store. */
    public String storageKey() {
        return originalKey != null ? originalKey : key;
    }
}
