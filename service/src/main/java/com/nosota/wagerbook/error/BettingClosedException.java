package com.nosota.wagerbook.error;

public class BettingClosedException extends Exception {
    public BettingClosedException(String message) {
        super(message);
    }

    public BettingClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
