package com.shadowcollector.label_storage.category;

/**
 * Raised at startup when a category or label-id source is missing or malformed.
 * No partially loaded table is ever used after this is thrown.
 */
public class CategoryConfigurationException extends RuntimeException {

    public CategoryConfigurationException(String message) {
        super(message);
    }

    public CategoryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
