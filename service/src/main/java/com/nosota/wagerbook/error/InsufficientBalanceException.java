package com.nosota.wagerbook.error;

import lombok.Getter;

@Getter
public class InsufficientBalanceException extends Exception {
    private final Long userId;
    private final long balance;
    private final long required;

    public InsufficientBalanceException(Long userId, long balance, long required) {
        super("Insufficient balance: userId=" + userId + ", balance=" + balance + ", required=" + required);
        this.userId = userId;
        this.balance = balance;
        this.required = required;
    }
}
