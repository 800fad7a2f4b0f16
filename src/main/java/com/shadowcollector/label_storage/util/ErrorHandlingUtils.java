/**
 * Utility class for standardized error handling across the application
 * Maps store, parse and lookup failures onto a small set of categories
 * used for log levels and metrics
 */

package com.shadowcollector.label_storage.util;

import com.shadowcollector.label_storage.migration.MetadataParseException;
import com.shadowcollector.label_storage.monitoring.MetricsService;
import com.shadowcollector.label_storage.service.ObjectNotFoundException;
import com.shadowcollector.label_storage.service.ObjectStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import software.amazon.awssdk.core.exception.SdkException;

public final class ErrorHandlingUtils {

    /**
     * Standard error categorization for consistent handling
     */
    public enum ErrorCategory {
        NOT_FOUND,
        S3,
        PARSE,
        GENERAL
    }

    private ErrorHandlingUtils() {
        // Utility class
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.GENERAL;
        }
        if (throwable instanceof ObjectNotFoundException) {
            return ErrorCategory.NOT_FOUND;
        } else if (throwable instanceof ObjectStoreException || throwable instanceof SdkException) {
            return ErrorCategory.S3;
        } else if (throwable instanceof MetadataParseException || throwable instanceof JsonProcessingException) {
            return ErrorCategory.PARSE;
        } else if (throwable.getCause() != null && throwable.getCause() != throwable) {
            return categorizeError(throwable.getCause());
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Logs a failed operation at the level its category warrants and counts it by category.
     *
     * @param logger The logger to use
     * @param operationName Name of the operation for logging
     * @param metricsService Optional metrics service for tracking
     * @param throwable The failure
     * @return the category the failure was filed under
     */
    public static ErrorCategory logFailure(Logger logger,
                                           String operationName,
                                           MetricsService metricsService,
                                           Throwable throwable) {
        ErrorCategory category = categorizeError(throwable);
        switch (category) {
            case NOT_FOUND:
                logger.error("Object missing in {}: {}", operationName, throwable.getMessage());
                break;
            case S3:
                logger.error("Object store error in {}: {}", operationName, throwable.getMessage());
                break;
            case PARSE:
                logger.error("Unreadable metadata in {}: {}", operationName, throwable.getMessage());
                break;
            default:
                logger.error("Error in {}: {}", operationName, throwable.getMessage(), throwable);
        }
        if (metricsService != null) {
            metricsService.incrementFailure(category);
        }
        return category;
    }
}
