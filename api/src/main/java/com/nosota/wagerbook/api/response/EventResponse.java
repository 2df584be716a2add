package com.nosota.wagerbook.api.response;

import com.nosota.wagerbook.api.model.EventStatus;

import java.time.Instant;
import java.util.List;

public record EventResponse(
        Long eventId,
        String league,
        String homeTeam,
        String awayTeam,
        Instant startsAt,
        EventStatus status,
        Integer homeScore,
        Integer awayScore,
        List<MarketResponse> markets
) {}
