package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request for creating a bettor account.
 *
 * @param displayName    Name shown to the group
 * @param initialBalance Opening balance in cents, recorded as a DEPOSIT entry. Defaults to 10000 when null.
 */
public record CreateUserRequest(
        @NotBlank(message = "Display name is required")
        @Size(max = 100, message = "Display name must be less than 100 characters")
        String displayName,

        @PositiveOrZero(message = "Initial balance must be non-negative")
        Long initialBalance
) {
}
