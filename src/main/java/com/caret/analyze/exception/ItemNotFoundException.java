package com.caret.analyze.exception;

/**
 * Runtime exception thrown when no item satisfies a lookup condition,
 * or when no item is similar enough to the requested name.
 */
public class ItemNotFoundException extends LookupException {

    public ItemNotFoundException(String message) {
        super(message);
    }

    public ItemNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
