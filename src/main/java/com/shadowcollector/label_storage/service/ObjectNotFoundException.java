package com.shadowcollector.label_storage.service;

/**
 * Raised when a key is absent from the bucket.
 */
public class ObjectNotFoundException extends ObjectStoreException {

    public ObjectNotFoundException(String key) {
        super("Object not found: " + key, key);
    }

    public ObjectNotFoundException(String key, Throwable cause) {
        super("Object not found: " + key, key, cause);
    }
}
