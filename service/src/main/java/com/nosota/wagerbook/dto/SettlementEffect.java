package com.nosota.wagerbook.dto;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.WagerStatus;

/**
 * Outcome of one settlement transition: the wager's new status and the single ledger credit it
 * implies. {@code entryType} is null when the transition moves no points (a loss).
 */
public record SettlementEffect(WagerStatus status, LedgerEntryType entryType, long amount) {

    public static SettlementEffect credit(WagerStatus status, LedgerEntryType entryType, long amount) {
        return new SettlementEffect(status, entryType, amount);
    }

    public static SettlementEffect none(WagerStatus status) {
        return new SettlementEffect(status, null, 0L);
    }

    public boolean hasLedgerEntry() {
        return entryType != null;
    }
}
