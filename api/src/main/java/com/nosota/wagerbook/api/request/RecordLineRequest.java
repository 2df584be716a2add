package com.nosota.wagerbook.api.request;

import com.nosota.wagerbook.api.model.Selection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single price quote delivered by the odds ingestion job.
 *
 * @param selection  Side being priced
 * @param point      Spread or total value, null for moneyline
 * @param price      American odds, never 0
 * @param source     Provider tag, e.g. "draftkings:DraftKings"
 * @param capturedAt Quote time at the provider, defaults to now when null
 */
public record RecordLineRequest(
        @NotNull(message = "Selection is required")
        Selection selection,

        BigDecimal point,

        @NotNull(message = "Price is required")
        Integer price,

        @NotBlank(message = "Source is required")
        String source,

        Instant capturedAt
) {
}
