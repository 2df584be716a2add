package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record CreateEventRequest(
        @NotBlank(message = "League is required")
        String league,

        @NotBlank(message = "Home team is required")
        String homeTeam,

        @NotBlank(message = "Away team is required")
        String awayTeam,

        @NotNull(message = "Start time is required")
        Instant startsAt
) {
}
