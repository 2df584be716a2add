package com.nosota.wagerbook.tests;

import com.nosota.wagerbook.TestBase;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.api.response.UserStatisticsResponse;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("12. User Tests")
public class UserStatisticsTest extends TestBase {

    @Test
    @DisplayName("USR-001: Default opening balance is 10000")
    void testDefaultOpeningBalance() throws Exception {
        User user = userService.createUser("default-balance", null);

        assertThat(user.getBalance()).isEqualTo(10000L);
        assertLedgerConsistent(user.getId());
    }

    @Test
    @DisplayName("USR-002: Statistics count outcomes and realized profit")
    void testStatistics() throws Exception {
        Long userId = createUser(20000L);
        Line line = createOpenMoneylineLine(Selection.HOME, -110);

        Long won = wagerLedgerEngine.placeWager(userId, line.getId(), 5000L).getId();
        Long lost = wagerLedgerEngine.placeWager(userId, line.getId(), 1000L).getId();
        Long push = wagerLedgerEngine.placeWager(userId, line.getId(), 2000L).getId();
        wagerLedgerEngine.placeWager(userId, line.getId(), 500L);
        wagerLedgerEngine.settleWager(won, WagerStatus.WON);
        wagerLedgerEngine.settleWager(lost, WagerStatus.LOST);
        wagerLedgerEngine.settleWager(push, WagerStatus.PUSH);

        UserStatisticsResponse stats = userService.getStatistics(userId);

        assertThat(stats.totalWagers()).isEqualTo(4);
        assertThat(stats.pending()).isEqualTo(1);
        assertThat(stats.won()).isEqualTo(1);
        assertThat(stats.lost()).isEqualTo(1);
        assertThat(stats.push()).isEqualTo(1);
        assertThat(stats.voided()).isZero();
        assertThat(stats.totalStaked()).isEqualTo(8500L);
        // +4545 on the win, -1000 on the loss, 0 on the push
        assertThat(stats.netProfit()).isEqualTo(3545L);
        assertThat(stats.winRate()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.balance()).isEqualTo(20000L - 8500L + 9545L + 2000L);
    }

    @Test
    @DisplayName("USR-003: Users over REST")
    void testUserEndpoints() throws Exception {
        String json = mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"rest-user\",\"initialBalance\":2500}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.balance").value(2500))
                .andReturn().getResponse().getContentAsString();
        long userId = objectMapper.readTree(json).get("userId").asLong();

        mockMvc.perform(get("/api/v1/users/{userId}/statistics", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalWagers").value(0))
                .andExpect(jsonPath("$.winRate").value(0.0));

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"\",\"initialBalance\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/v1/users/{userId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }
}
