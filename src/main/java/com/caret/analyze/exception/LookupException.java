package com.caret.analyze.exception;

/**
 * Base class for failures raised while looking up an item in a collection.
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
