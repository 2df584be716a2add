package com.nosota.wagerbook.api;

import com.nosota.wagerbook.api.dto.LedgerEntryDTO;
import com.nosota.wagerbook.api.dto.PagedResponse;
import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.request.DepositRequest;
import com.nosota.wagerbook.api.request.WithdrawalRequest;
import com.nosota.wagerbook.api.response.BalanceResponse;
import com.nosota.wagerbook.api.response.FundsResponse;
import com.nosota.wagerbook.api.response.ReconciliationResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Ledger API interface.
 *
 * <p>Defines REST endpoints for the balance ledger:
 * <ul>
 *   <li>Query operations (balance, ledger entries)</li>
 *   <li>Funds operations outside the wager flow (deposit, withdrawal)</li>
 *   <li>Reconciliation (balance equals the sum of ledger entries)</li>
 * </ul>
 *
 * <p>Ledger entries are append-only, there are no update or delete endpoints.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>LedgerController - in service module (server-side implementation)</li>
 *   <li>LedgerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/ledger")
public interface LedgerApi {

    /**
     * Lists ledger entries, newest first.
     *
     * @param userId  Optional filter by user
     * @param type    Optional filter by entry type
     * @param wagerId Optional filter by wager
     * @param page    Zero-based page
     * @param size    Page size, 1..100
     */
    @GetMapping("/entries")
    ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(
            @RequestParam(value = "userId", required = false) Long userId,
            @RequestParam(value = "type", required = false) LedgerEntryType type,
            @RequestParam(value = "wagerId", required = false) Long wagerId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(100) int size);

    @GetMapping("/users/{userId}/balance")
    ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") Long userId) throws Exception;

    @PostMapping("/users/{userId}/deposit")
    ResponseEntity<FundsResponse> deposit(
            @PathVariable("userId") Long userId,
            @RequestBody @Valid DepositRequest request) throws Exception;

    @PostMapping("/users/{userId}/withdraw")
    ResponseEntity<FundsResponse> withdraw(
            @PathVariable("userId") Long userId,
            @RequestBody @Valid WithdrawalRequest request) throws Exception;

    /**
     * Checks the ledger-balance equality of one user.
     */
    @GetMapping("/users/{userId}/reconciliation")
    ResponseEntity<ReconciliationResponse> reconcileUser(@PathVariable("userId") Long userId) throws Exception;

    /**
     * Returns every user whose balance differs from the sum of its ledger entries.
     * An empty list means the ledger is consistent.
     */
    @GetMapping("/reconciliation")
    ResponseEntity<List<ReconciliationResponse>> reconcileAll();
}
