package com.nosota.wagerbook.api.model;

/**
 * Side of a market a line prices. OVER/UNDER belong to TOTAL markets,
 * HOME/AWAY to MONEYLINE and SPREAD markets.
 */
public enum Selection {
    HOME,
    AWAY,
    OVER,
    UNDER;

    public boolean appliesTo(MarketType marketType) {
        if (marketType == MarketType.TOTAL) {
            return this == OVER || this == UNDER;
        }
        return this == HOME || this == AWAY;
    }
}
