package com.shadowcollector.label_storage.types;

/**
 * Classification of an object key against the canonical storage layout.
 * Exactly one value applies to any key.
 */
public enum PathViolationType {
    VALID("valid"),
    OLD_TASKID("old-taskid"),
    OLD_FLAT("old-flat"),
    URL_ENCODED_ROOT("url-encoded-root"),
    UNKNOWN("unknown");

    private final String wireName;

    PathViolationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
