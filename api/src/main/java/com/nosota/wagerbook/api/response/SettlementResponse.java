package com.nosota.wagerbook.api.response;

import com.nosota.wagerbook.api.dto.LedgerEntryDTO;
import com.nosota.wagerbook.api.model.WagerStatus;

/**
 * Result of grading a wager.
 *
 * @param status      Terminal status the wager moved to
 * @param ledgerDelta Balance change applied by the settlement (0 for LOST)
 * @param ledgerEntry Payout or refund entry, null for LOST
 * @param balance     User balance after settlement
 */
public record SettlementResponse(
        Long wagerId,
        Long userId,
        WagerStatus status,
        Long ledgerDelta,
        LedgerEntryDTO ledgerEntry,
        Long balance
) {}
