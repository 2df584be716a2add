package com.nosota.wagerbook.error;

public class MarketNotFoundException extends NotFoundException {
    public MarketNotFoundException(Long id) {
        super("Market not found: id=" + id);
    }

    public MarketNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "MARKET_NOT_FOUND";
    }
}
