/**
 * Result wrapper for loading a startup lookup table
 *
 * Features:
 * - Distinguishes a loaded table from a missing or malformed source
 * - Carries the source description for diagnostics
 * - Lets configuration decide whether a failure is fatal
 */

package com.shadowcollector.label_storage.types;

import java.util.Objects;
import java.util.Optional;

public final class TableLoadResult<T> {

    public enum Status {
        LOADED,
        MISSING,
        MALFORMED
    }

    private final Status status;
    private final T table;
    private final String source;
    private final String errorMessage;

    private TableLoadResult(Status status, T table, String source, String errorMessage) {
        this.status = status;
        this.table = table;
        this.source = source;
        this.errorMessage = errorMessage;
    }

    public static <T> TableLoadResult<T> loaded(T table, String source) {
        return new TableLoadResult<>(Status.LOADED, Objects.requireNonNull(table, "table"), source, null);
    }

    public static <T> TableLoadResult<T> missing(String source) {
        return new TableLoadResult<>(Status.MISSING, null, source, "Source not found: " + source);
    }

    public static <T> TableLoadResult<T> malformed(String source, String errorMessage) {
        return new TableLoadResult<>(Status.MALFORMED, null, source, errorMessage);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }

    public Status getStatus() {
        return status;
    }

    public Optional<T> getTable() {
        return Optional.ofNullable(table);
    }

    public String getSource() {
        return source;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "TableLoadResult{status=" + status + ", source='" + source + '\'' +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") + '}';
    }
}
