package com.shadowcollector.label_storage.types;

import com.shadowcollector.label_storage.util.S3Paths;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Workflow kinds that own a top-level directory in the bucket.
 * The path segment is the first component of every stored key.
 */
public enum StorageType {
    DETECTION("detection"),
    MULTIMODAL("multimodal"),
    TEXT_QA("text-qa"),
    CLASSIFY("classify"),
    QA_PAIR("qa-pair");

    private final String pathSegment;

    StorageType(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String pathSegment() {
        return pathSegment;
    }

    /** Listing prefix for this type, always slash terminated. */
    public String prefix() {
        return S3Paths.ensureTrailingSlash(pathSegment);
    }

    /**
     * Regex alternation of all path segments, e.g. {@code detection|multimodal|...}.
     */
    public static String segmentAlternation() {
        return Arrays.stream(values())
            .map(StorageType::pathSegment)
            .map(s -> s.replace("-", "\\-"))
            .collect(Collectors.joining("|"));
    }

    @Override
    public String toString() {
        return pathSegment;
    }
}
