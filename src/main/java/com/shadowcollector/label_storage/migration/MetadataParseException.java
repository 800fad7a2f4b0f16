package com.shadowcollector.label_storage.migration;

/**
 * A pair's metadata JSON could not be read as a JSON object.
 */
public class MetadataParseException extends RuntimeException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
