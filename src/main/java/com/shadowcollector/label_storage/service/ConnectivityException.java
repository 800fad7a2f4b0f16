package com.shadowcollector.label_storage.service;

/**
 * Object store unreachable at the start of a run. Fatal.
 */
public class ConnectivityException extends RuntimeException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
