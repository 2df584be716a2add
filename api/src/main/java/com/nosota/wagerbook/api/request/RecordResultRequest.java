package com.nosota.wagerbook.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Final score of an event. Recording it marks the event FINAL and makes its
 * pending wagers eligible for the grading sweep.
 */
public record RecordResultRequest(
        @NotNull @PositiveOrZero
        Integer homeScore,

        @NotNull @PositiveOrZero
        Integer awayScore
) {
}
