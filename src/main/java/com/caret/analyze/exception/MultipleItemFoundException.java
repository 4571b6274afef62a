package com.caret.analyze.exception;

/**
 * Runtime exception thrown when more than one item satisfies a condition
 * that is expected to identify a single item.
 */
public class MultipleItemFoundException extends LookupException {

    public MultipleItemFoundException(String message) {
        super(message);
    }

    public MultipleItemFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
