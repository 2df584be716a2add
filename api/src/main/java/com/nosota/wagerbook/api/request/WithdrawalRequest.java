package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for removing points from a user outside the wager flow.
 *
 * @param amount      Amount in cents, positive (recorded as a negative entry)
 * @param description Free text for the ledger entry
 */
public record WithdrawalRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String description
) {
}
