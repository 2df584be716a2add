package com.nosota.wagerbook.api.response;

import com.nosota.wagerbook.api.model.WagerStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wager as accepted, with the frozen price and point.
 *
 * @param potentialPayoutCents Stake plus profit if the wager wins at the accepted price
 */
public record WagerResponse(
        Long wagerId,
        Long userId,
        Long lineId,
        Long stakeCents,
        Integer acceptedPrice,
        BigDecimal acceptedPoint,
        WagerStatus status,
        Instant placedAt,
        Instant settledAt,
        Long potentialPayoutCents
) {}
