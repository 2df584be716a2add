package com.nosota.wagerbook.api.response;

import com.nosota.wagerbook.api.dto.LedgerEntryDTO;

/**
 * Response for deposit and withdrawal operations.
 */
public record FundsResponse(
        Long userId,
        LedgerEntryDTO ledgerEntry,
        Long balance
) {}
