package com.nosota.wagerbook.tests;

import com.nosota.wagerbook.TestBase;
import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.MarketType;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.error.EventNotFoundException;
import com.nosota.wagerbook.error.InvalidOddsException;
import com.nosota.wagerbook.error.LineNotFoundException;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("10. Odds Snapshot Tests")
public class OddsSnapshotTest extends TestBase {

    @Test
    @DisplayName("ODD-001: Latest line is the most recently captured quote")
    void testLatestLine() throws Exception {
        Event event = createEventStartingIn(Duration.ofHours(1));
        Market market = oddsSnapshotService.getOrCreateMarket(event.getId(), MarketType.TOTAL);
        Instant t0 = Instant.now().minusSeconds(60);

        oddsSnapshotService.recordLine(market.getId(), Selection.OVER, new BigDecimal("47.5"), -110, "feed", t0);
        Line newer = oddsSnapshotService.recordLine(market.getId(), Selection.OVER, new BigDecimal("48.5"), -105, "feed",
                t0.plusSeconds(30));
        // arrives late but was captured earlier
        oddsSnapshotService.recordLine(market.getId(), Selection.OVER, new BigDecimal("46.5"), -115, "feed",
                t0.plusSeconds(10));
        Line under = oddsSnapshotService.recordLine(market.getId(), Selection.UNDER, new BigDecimal("48.5"), -115, "feed",
                t0.plusSeconds(30));

        assertThat(oddsSnapshotService.latestLine(market.getId(), Selection.OVER).getId()).isEqualTo(newer.getId());
        assertThat(oddsSnapshotService.latestLines(market.getId()))
                .extracting(Line::getId)
                .containsExactlyInAnyOrder(newer.getId(), under.getId());
        assertThatThrownBy(() -> oddsSnapshotService.latestLine(market.getId(), Selection.HOME))
                .isInstanceOf(LineNotFoundException.class);
    }

    @Test
    @DisplayName("ODD-002: Invalid quotes are rejected")
    void testInvalidQuotes() throws Exception {
        Event event = createEventStartingIn(Duration.ofHours(1));
        Market moneyline = oddsSnapshotService.getOrCreateMarket(event.getId(), MarketType.MONEYLINE);

        assertThatThrownBy(() -> oddsSnapshotService.recordLine(moneyline.getId(), Selection.HOME, null, 0, "feed", null))
                .isInstanceOf(InvalidOddsException.class);
        assertThatThrownBy(() -> oddsSnapshotService.recordLine(moneyline.getId(), Selection.OVER, null, 100, "feed", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(oddsSnapshotService.latestLines(moneyline.getId())).isEmpty();
    }

    @Test
    @DisplayName("ODD-003: One market per event and type")
    void testMarketUnique() throws Exception {
        Event event = createEventStartingIn(Duration.ofHours(1));

        Market first = oddsSnapshotService.getOrCreateMarket(event.getId(), MarketType.SPREAD);
        Market second = oddsSnapshotService.getOrCreateMarket(event.getId(), MarketType.SPREAD);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThatThrownBy(() -> oddsSnapshotService.getOrCreateMarket(Long.MAX_VALUE, MarketType.SPREAD))
                .isInstanceOf(EventNotFoundException.class);
    }

    @Test
    @DisplayName("ODD-004: Event status moves forward only")
    void testEventStatusForwardOnly() throws Exception {
        Event event = createEventStartingIn(Duration.ofHours(1));

        oddsSnapshotService.updateEventStatus(event.getId(), EventStatus.LIVE);
        oddsSnapshotService.updateEventStatus(event.getId(), EventStatus.LIVE);

        assertThatThrownBy(() -> oddsSnapshotService.updateEventStatus(event.getId(), EventStatus.SCHEDULED))
                .isInstanceOf(IllegalStateException.class);

        Event finished = oddsSnapshotService.recordFinalScore(event.getId(), 24, 21);
        assertThat(finished.getStatus()).isEqualTo(EventStatus.FINAL);
        assertThat(finished.hasFinalScore()).isTrue();
    }

    @Test
    @DisplayName("ODD-005: Catalogue over REST")
    void testCatalogueEndpoints() throws Exception {
        String eventJson = mockMvc.perform(post("/api/v1/odds/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"league\":\"NHL\",\"homeTeam\":\"Toronto Maple Leafs\","
                                + "\"awayTeam\":\"Montreal Canadiens\",\"startsAt\":\""
                                + Instant.now().plus(Duration.ofDays(1)) + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("SCHEDULED"))
                .andReturn().getResponse().getContentAsString();
        long eventId = objectMapper.readTree(eventJson).get("eventId").asLong();

        String marketJson = mockMvc.perform(post("/api/v1/odds/events/{eventId}/markets", eventId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"MONEYLINE\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        long marketId = objectMapper.readTree(marketJson).get("marketId").asLong();

        mockMvc.perform(post("/api/v1/odds/markets/{marketId}/lines", marketId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selection\":\"HOME\",\"price\":-135,\"source\":\"feed\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.price").value(-135));

        mockMvc.perform(post("/api/v1/odds/markets/{marketId}/lines", marketId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selection\":\"AWAY\",\"price\":0,\"source\":\"feed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ODDS"));

        mockMvc.perform(get("/api/v1/odds/markets/{marketId}/lines/latest", marketId).param("selection", "HOME"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(-135));

        mockMvc.perform(put("/api/v1/odds/events/{eventId}/status", eventId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"LIVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.markets[0].latestLines[0].selection").value("HOME"));

        mockMvc.perform(put("/api/v1/odds/events/{eventId}/status", eventId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"SCHEDULED\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/odds/events/{eventId}/result", eventId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"homeScore\":3,\"awayScore\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FINAL"))
                .andExpect(jsonPath("$.homeScore").value(3));

        mockMvc.perform(post("/api/v1/odds/events/{eventId}/markets", Long.MAX_VALUE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"TOTAL\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_FOUND"));
    }
}
