package com.nosota.wagerbook.api;

import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.api.request.PlaceWagerRequest;
import com.nosota.wagerbook.api.request.SettleWagerRequest;
import com.nosota.wagerbook.api.response.SettlementResponse;
import com.nosota.wagerbook.api.response.WagerResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Wager API interface.
 *
 * <p>Defines the two mutating operations of the wager ledger:
 * <ul>
 *   <li>Placing a wager (stake debited, price frozen)</li>
 *   <li>Settling a wager (WON, LOST, PUSH or VOID, exactly once)</li>
 * </ul>
 * plus read access to wagers.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WagerController - in service module (server-side implementation)</li>
 *   <li>WagerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/wagers")
public interface WagerApi {

    /**
     * Places a wager against a line.
     *
     * @param request User, line and stake
     * @return Accepted wager with the frozen price and potential payout
     */
    @PostMapping
    ResponseEntity<WagerResponse> placeWager(@RequestBody @Valid PlaceWagerRequest request) throws Exception;

    /**
     * Settles a pending wager.
     *
     * <p>A second call for the same wager fails with 409 and the existing status,
     * it is never applied twice.
     *
     * @param wagerId Wager to grade
     * @param request Outcome (WON, LOST, PUSH, VOID)
     * @return Final status, ledger delta and new balance
     */
    @PostMapping("/{wagerId}/settle")
    ResponseEntity<SettlementResponse> settleWager(
            @PathVariable("wagerId") Long wagerId,
            @RequestBody @Valid SettleWagerRequest request) throws Exception;

    @GetMapping("/{wagerId}")
    ResponseEntity<WagerResponse> getWager(@PathVariable("wagerId") Long wagerId) throws Exception;

    /**
     * Lists wagers, most recent first.
     *
     * @param userId Optional filter by bettor
     * @param status Optional filter by status
     */
    @GetMapping
    ResponseEntity<List<WagerResponse>> getWagers(
            @RequestParam(value = "userId", required = false) Long userId,
            @RequestParam(value = "status", required = false) WagerStatus status);
}
