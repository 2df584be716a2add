package com.nosota.wagerbook.tests;

import com.nosota.wagerbook.TestBase;
import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.model.LedgerEntry;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Wager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.http.MediaType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the balance ledger.
 *
 * <ul>
 *   <li>LED-001: opening balance is a ledger entry</li>
 *   <li>LED-002..003: deposits and withdrawals</li>
 *   <li>LED-004: entry listing</li>
 *   <li>LED-005: reconciliation</li>
 * </ul>
 */
@DisplayName("8. Ledger Tests")
public class LedgerTest extends TestBase {

    @Test
    @DisplayName("LED-001: Opening balance is booked as a deposit")
    void testOpeningBalance() throws Exception {
        Long userId = createUser(20000L);

        Page<LedgerEntry> entries = balanceLedgerService.findEntries(userId, null, null, 0, 50);

        assertThat(entries.getContent()).hasSize(1);
        assertThat(entries.getContent().get(0).getType()).isEqualTo(LedgerEntryType.DEPOSIT);
        assertThat(entries.getContent().get(0).getAmount()).isEqualTo(20000L);
        assertThat(entries.getContent().get(0).getWagerId()).isNull();
        assertLedgerConsistent(userId);
    }

    @Test
    @DisplayName("LED-002: Deposit and withdrawal move the balance through the ledger")
    void testDepositAndWithdraw() throws Exception {
        Long userId = createUser(0L);

        balanceLedgerService.deposit(userId, 5000L, "Top-up");
        LedgerEntry withdrawal = balanceLedgerService.withdraw(userId, 2000L, null);

        assertThat(withdrawal.getType()).isEqualTo(LedgerEntryType.WITHDRAWAL);
        assertThat(withdrawal.getAmount()).isEqualTo(-2000L);
        assertThat(withdrawal.getDescription()).isEqualTo("Withdrawal");
        assertThat(balanceLedgerService.getBalance(userId)).isEqualTo(3000L);
        assertLedgerConsistent(userId);
    }

    @Test
    @DisplayName("LED-003: Overdrawing withdrawal is rejected")
    void testOverdraw() throws Exception {
        Long userId = createUser(1000L);

        assertThatThrownBy(() -> balanceLedgerService.withdraw(userId, 1001L, null))
                .isInstanceOf(InsufficientBalanceException.class);
        assertThatThrownBy(() -> balanceLedgerService.deposit(Long.MAX_VALUE, 100L, null))
                .isInstanceOf(UserNotFoundException.class);

        assertThat(balanceLedgerService.getBalance(userId)).isEqualTo(1000L);
        assertLedgerConsistent(userId);
    }

    @Test
    @DisplayName("LED-004: Entries are listed newest first and filtered")
    void testEntryListing() throws Exception {
        Long userId = createUser(20000L);
        Line line = createOpenMoneylineLine(Selection.HOME, -110);
        Wager wager = wagerLedgerEngine.placeWager(userId, line.getId(), 5000L);
        wagerLedgerEngine.settleWager(wager.getId(), WagerStatus.WON);

        mockMvc.perform(get("/api/v1/ledger/entries")
                        .param("userId", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(3))
                .andExpect(jsonPath("$.data[0].type").value("WAGER_PAYOUT"))
                .andExpect(jsonPath("$.data[0].amount").value(9545))
                .andExpect(jsonPath("$.data[2].type").value("DEPOSIT"));

        mockMvc.perform(get("/api/v1/ledger/entries")
                        .param("wagerId", wager.getId().toString())
                        .param("type", "WAGER_STAKE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(1))
                .andExpect(jsonPath("$.data[0].amount").value(-5000));

        mockMvc.perform(get("/api/v1/ledger/entries").param("size", "101"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("LED-005: Reconciliation reports consistent users")
    void testReconciliation() throws Exception {
        Long userId = createUser(7500L);

        mockMvc.perform(get("/api/v1/ledger/users/{userId}/reconciliation", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(7500))
                .andExpect(jsonPath("$.ledgerSum").value(7500))
                .andExpect(jsonPath("$.consistent").value(true));

        assertThat(balanceConsistencyService.verifyAll()).isEmpty();
    }

    @Test
    @DisplayName("LED-006: Deposit over REST returns the entry and new balance")
    void testDepositEndpoint() throws Exception {
        Long userId = createUser(100L);

        mockMvc.perform(post("/api/v1/ledger/users/{userId}/deposit", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 900, \"description\": \"Bonus\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ledgerEntry.type").value("DEPOSIT"))
                .andExpect(jsonPath("$.balance").value(1000));

        mockMvc.perform(post("/api/v1/ledger/users/{userId}/withdraw", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 5000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"));

        mockMvc.perform(get("/api/v1/ledger/users/{userId}/balance", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(1000));
    }
}
