package com.nosota.wagerbook.api.request;

import com.nosota.wagerbook.api.model.MarketType;
import jakarta.validation.constraints.NotNull;

public record CreateMarketRequest(
        @NotNull(message = "Market type is required")
        MarketType type
) {
}
