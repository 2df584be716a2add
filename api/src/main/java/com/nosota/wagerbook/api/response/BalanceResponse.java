package com.nosota.wagerbook.api.response;

/**
 * Response for user balance query.
 */
public record BalanceResponse(
        Long userId,
        Long balance
) {}
