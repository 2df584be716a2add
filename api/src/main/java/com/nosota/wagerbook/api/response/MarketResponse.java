package com.nosota.wagerbook.api.response;

import com.nosota.wagerbook.api.dto.LineDTO;
import com.nosota.wagerbook.api.model.MarketType;

import java.util.List;

/**
 * Market with the latest line per selection.
 */
public record MarketResponse(
        Long marketId,
        Long eventId,
        MarketType type,
        List<LineDTO> latestLines
) {}
