package com.shadowcollector.label_storage.types;

/**
 * Per-pair outcome recorded by the stats tracker.
 */
public enum RecordType {
    MIGRATED,
    SKIPPED,
    ERROR,
    RECLASSIFIED
}
