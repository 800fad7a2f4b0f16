/**
 * Exception thrown when an object store call fails
 *
 * Features:
 * - Carries the key the failed call was made for
 * - Caught per pair by the migration run and recorded as an error
 * - Propagated unchanged out of placements
 */

package com.shadowcollector.label_storage.service;

public class ObjectStoreException extends RuntimeException {

    private final String key;

    public ObjectStoreException(String message, String key) {
        super(message);
        this.key = key;
    }

    public ObjectStoreException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
