package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request for placing a wager against a betting line.
 *
 * <p>The price and point are not part of the request: they are read from the line
 * at acceptance time and frozen on the wager.
 *
 * @param userId     Bettor placing the wager
 * @param lineId     Line being bet on
 * @param stakeCents Stake in cents, at least 1
 */
public record PlaceWagerRequest(
        @NotNull(message = "User ID is required")
        Long userId,

        @NotNull(message = "Line ID is required")
        Long lineId,

        @NotNull(message = "Stake is required")
        @Min(value = 1, message = "Stake must be at least 1 cent")
        Long stakeCents
) {
}
