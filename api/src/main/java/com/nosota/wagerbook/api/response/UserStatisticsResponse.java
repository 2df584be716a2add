package com.nosota.wagerbook.api.response;

/**
 * Wagering record of a user.
 *
 * @param netProfit Sum of payouts and refunds minus stakes, over settled wagers only
 * @param winRate   WON / (WON + LOST), 0 when nothing has been decided
 */
public record UserStatisticsResponse(
        Long userId,
        String displayName,
        Long balance,
        long totalWagers,
        long pending,
        long won,
        long lost,
        long push,
        long voided,
        Long totalStaked,
        Long netProfit,
        double winRate
) {}
