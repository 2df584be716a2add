package com.nosota.wagerbook.dto;

public record BalanceCheck(Long userId, long balance, long ledgerSum) {
    public boolean isConsistent() {
        return balance == ledgerSum;
    }
}
