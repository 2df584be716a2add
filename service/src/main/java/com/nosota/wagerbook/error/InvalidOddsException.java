package com.nosota.wagerbook.error;

/**
 * American odds of 0 have no meaning. Unchecked: only reachable through a programming error or
 * unvalidated line input, since stored lines never carry price 0.
 */
public class InvalidOddsException extends IllegalArgumentException {
    public InvalidOddsException(String message) {
        super(message);
    }
}
