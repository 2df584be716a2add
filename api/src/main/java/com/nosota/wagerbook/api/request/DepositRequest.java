package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for adding points to a user from outside the wager flow.
 *
 * @param amount      Amount in cents, positive
 * @param description Free text for the ledger entry
 */
public record DepositRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String description
) {
}
