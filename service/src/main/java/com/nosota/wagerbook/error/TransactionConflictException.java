package com.nosota.wagerbook.error;

/**
 * The operation lost a race for a row lock, hit the transaction timeout or tripped a ledger
 * uniqueness constraint. Nothing was committed; the caller may retry.
 */
public class TransactionConflictException extends Exception {
    public TransactionConflictException(String message) {
        super(message);
    }

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
