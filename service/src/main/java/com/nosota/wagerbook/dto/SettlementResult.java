package com.nosota.wagerbook.dto;

import com.nosota.wagerbook.model.LedgerEntry;
import com.nosota.wagerbook.model.Wager;

/**
 * Result of a committed settlement.
 *
 * @param wager       the settled wager
 * @param ledgerEntry payout or refund entry, null for a loss
 * @param ledgerDelta amount credited to the user (0 for a loss)
 * @param balance     user balance after settlement
 */
public record SettlementResult(Wager wager, LedgerEntry ledgerEntry, long ledgerDelta, long balance) {
}
