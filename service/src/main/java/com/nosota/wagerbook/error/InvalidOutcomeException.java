package com.nosota.wagerbook.error;

public class InvalidOutcomeException extends Exception {
    public InvalidOutcomeException(String message) {
        super(message);
    }

    public InvalidOutcomeException(String message, Throwable cause) {
        super(message, cause);
    }
}
