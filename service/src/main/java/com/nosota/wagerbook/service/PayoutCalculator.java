package com.nosota.wagerbook.service;

import com.nosota.wagerbook.error.InvalidOddsException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Payout arithmetic for American odds.
 *
 * <p>Positive odds {@code +N}: profit = stake * N / 100.
 * Negative odds {@code -N}: profit = stake * 100 / N.
 * Profit is rounded to the nearest cent (half up); payout = stake + profit.
 *
 * <p>Examples: 5000 at -110 pays 9545; 1000 at +150 pays 2500; 1000 at -200 pays 1500.
 */
public final class PayoutCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PayoutCalculator() {
    }

    /**
     * Total returned to the bettor on a win, stake included.
     *
     * @param stakeCents   stake, non-negative
     * @param americanOdds odds, non-zero
     * @return stake plus rounded profit
     * @throws InvalidOddsException     if odds are 0
     * @throws IllegalArgumentException if stake is negative
     */
    public static long calculatePayout(long stakeCents, int americanOdds) {
        return stakeCents + calculateProfit(stakeCents, americanOdds);
    }

    public static long calculateProfit(long stakeCents, int americanOdds) {
        if (americanOdds == 0) {
            throw new InvalidOddsException("American odds must not be 0");
        }
        if (stakeCents < 0) {
            throw new IllegalArgumentException("Stake must not be negative: " + stakeCents);
        }

        BigDecimal stake = BigDecimal.valueOf(stakeCents);
        BigDecimal profit;
        if (americanOdds > 0) {
            profit = stake.multiply(BigDecimal.valueOf(americanOdds))
                    .divide(HUNDRED, 0, RoundingMode.HALF_UP);
        } else {
            // widen before negating, -Integer.MIN_VALUE overflows an int
            profit = stake.multiply(HUNDRED)
                    .divide(BigDecimal.valueOf(-(long) americanOdds), 0, RoundingMode.HALF_UP);
        }
        return profit.longValueExact();
    }
}
