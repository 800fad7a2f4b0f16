package com.shadowcollector.label_storage.service;

import com.shadowcollector.label_storage.types.ObjectEntry;

import java.util.List;

/**
 * Object store capability used by placement and migration.
 * Calls are synchronous and never retried.
 */
public interface ObjectStore {

    /**
     * @throws ObjectNotFoundException when the key does not exist
     * @throws ObjectStoreException on any other failure
     */
    byte[] get(String key);

    void put(String key, byte[] bytes, String contentType);

    void copy(String sourceKey, String destinationKey);

    void delete(String key);

    boolean exists(String key);

    /**
     * Lists every object below the prefix, flattening pagination.
     */
    List<ObjectEntry> list(String prefix);

    /**
     * Lists objects directly below the prefix when a delimiter is given; common prefixes are not returned.
     */
    List<ObjectEntry> list(String prefix, String delimiter);

    /**
     * Probes the bucket before a run.
     *
     * @throws ConnectivityException when the bucket cannot be reached
     */
    void checkConnection();
}
