package com.nosota.wagerbook.error;

/**
 * Base of all "referenced record does not exist" failures. Subclasses supply the error code
 * reported to API clients.
 */
public abstract class NotFoundException extends Exception {
    protected NotFoundException(String message) {
        super(message);
    }

    public abstract String getCode();
}
