package com.nosota.wagerbook.tests;

import com.nosota.wagerbook.TestBase;
import com.nosota.wagerbook.api.model.MarketType;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.api.request.PlaceWagerRequest;
import com.nosota.wagerbook.api.request.SettleWagerRequest;
import com.nosota.wagerbook.api.response.WagerResponse;
import com.nosota.wagerbook.filter.CorrelationIdFilter;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST tests for wager placement and settlement, including the error contract.
 */
@DisplayName("9. Wager Controller Tests")
public class WagerControllerTest extends TestBase {

    private MvcResult place(Long userId, Long lineId, long stake) throws Exception {
        return mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(userId, lineId, stake))))
                .andReturn();
    }

    private String settleBody(String outcome) throws Exception {
        return objectMapper.writeValueAsString(new SettleWagerRequest(outcome));
    }

    @Test
    @DisplayName("API-001: Place and settle a winning wager")
    void testPlaceAndSettle() throws Exception {
        Long userId = createUser(20000L);
        Line line = createOpenMoneylineLine(Selection.HOME, -110);

        MvcResult placed = place(userId, line.getId(), 5000L);
        assertThat(placed.getResponse().getStatus()).isEqualTo(201);
        WagerResponse wager = objectMapper.readValue(placed.getResponse().getContentAsString(), WagerResponse.class);
        assertThat(wager.potentialPayoutCents()).isEqualTo(9545L);
        assertThat(wager.acceptedPrice()).isEqualTo(-110);

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("WON")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("WON"))
                .andExpect(jsonPath("$.ledgerDelta").value(9545))
                .andExpect(jsonPath("$.ledgerEntry.type").value("WAGER_PAYOUT"))
                .andExpect(jsonPath("$.balance").value(24545));

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("LOST")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("WAGER_ALREADY_SETTLED"))
                .andExpect(jsonPath("$.details.existingStatus").value("WON"));

        mockMvc.perform(get("/api/v1/wagers").param("userId", userId.toString()).param("status", "WON"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].wagerId").value(wager.wagerId()));
    }

    @Test
    @DisplayName("API-002: Error codes of failed placements")
    void testPlacementErrors() throws Exception {
        Long userId = createUser(1000L);
        Line openLine = createOpenMoneylineLine(Selection.HOME, 150);
        Event soon = createEventStartingIn(Duration.ofMinutes(2));
        Line closedLine = createLine(soon.getId(), MarketType.MONEYLINE, Selection.HOME, null, 150);

        mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(userId, closedLine.getId(), 100L))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BETTING_CLOSED"));

        mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(userId, openLine.getId(), 5000L))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.details.balance").value(1000));

        mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(userId, Long.MAX_VALUE, 100L))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LINE_NOT_FOUND"));

        mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(Long.MAX_VALUE, openLine.getId(), 100L))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));

        mockMvc.perform(post("/api/v1/wagers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PlaceWagerRequest(userId, openLine.getId(), 0L))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        assertLedgerConsistent(userId);
    }

    @Test
    @DisplayName("API-003: Error codes of failed settlements")
    void testSettlementErrors() throws Exception {
        Long userId = createUser(1000L);
        Line line = createOpenMoneylineLine(Selection.HOME, 150);
        WagerResponse wager = objectMapper.readValue(
                place(userId, line.getId(), 100L).getResponse().getContentAsString(), WagerResponse.class);

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("DRAW")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OUTCOME"));

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("PENDING")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OUTCOME"));

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("  ")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OUTCOME"));

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", wager.wagerId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OUTCOME"));

        mockMvc.perform(post("/api/v1/wagers/{wagerId}/settle", Long.MAX_VALUE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(settleBody("WON")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("WAGER_NOT_FOUND"));

        mockMvc.perform(get("/api/v1/wagers/{wagerId}", wager.wagerId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("API-004: Correlation ID is echoed, or generated when absent")
    void testCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/wagers/{wagerId}", Long.MAX_VALUE)
                        .header(CorrelationIdFilter.HEADER, "test-correlation-1"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(CorrelationIdFilter.HEADER, "test-correlation-1"));

        mockMvc.perform(get("/api/v1/wagers"))
                .andExpect(status().isOk())
                .andExpect(header().exists(CorrelationIdFilter.HEADER));
    }
}
