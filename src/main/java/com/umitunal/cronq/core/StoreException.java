package com.umitunal.cronq.core;

/**
 * Failure of an operation against the underlying document store.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
