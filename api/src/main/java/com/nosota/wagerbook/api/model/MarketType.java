package com.nosota.wagerbook.api.model;

public enum MarketType {
    MONEYLINE,
    SPREAD,
    TOTAL
}
