package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.dto.SettlementResult;
import com.nosota.wagerbook.error.AlreadySettledException;
import com.nosota.wagerbook.error.BettingClosedException;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.InvalidOutcomeException;
import com.nosota.wagerbook.error.LineNotFoundException;
import com.nosota.wagerbook.error.TransactionConflictException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.error.WagerNotFoundException;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Entry point of the wager ledger: placement, settlement and wager reads.
 *
 * <p>Sits outside the transactional services so it sees failures raised at commit time too.
 * Lock contention, lock or statement timeouts, and violations of the ledger's uniqueness backstop
 * are reported as {@link TransactionConflictException}; nothing was committed in that case and
 * the caller may retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerLedgerEngine {

    private final WagerAcceptanceService acceptanceService;
    private final WagerSettlementService settlementService;
    private final WagerRepository wagerRepository;

    public Wager placeWager(Long userId, Long lineId, Long stakeCents)
            throws LineNotFoundException, BettingClosedException, UserNotFoundException,
            InsufficientBalanceException, TransactionConflictException {
        try {
            return acceptanceService.placeWager(userId, lineId, stakeCents);
        } catch (ConcurrencyFailureException | QueryTimeoutException | TransactionTimedOutException
                 | DataIntegrityViolationException e) {
            throw conflict("placeWager userId=" + userId + ", lineId=" + lineId, e);
        }
    }

    public SettlementResult settleWager(Long wagerId, WagerStatus outcome)
            throws WagerNotFoundException, AlreadySettledException, InvalidOutcomeException,
            UserNotFoundException, InsufficientBalanceException, TransactionConflictException {
        try {
            return settlementService.settleWager(wagerId, outcome);
        } catch (ConcurrencyFailureException | QueryTimeoutException | TransactionTimedOutException
                 | DataIntegrityViolationException e) {
            throw conflict("settleWager wagerId=" + wagerId, e);
        }
    }

    /**
     * Settles with an outcome given as text, e.g. from a REST request body.
     *
     * @throws InvalidOutcomeException if the text is not one of WON, LOST, PUSH, VOID
     */
    public SettlementResult settleWager(Long wagerId, String outcome)
            throws WagerNotFoundException, AlreadySettledException, InvalidOutcomeException,
            UserNotFoundException, InsufficientBalanceException, TransactionConflictException {
        return settleWager(wagerId, parseOutcome(outcome));
    }

    @Transactional(readOnly = true)
    public Wager getWager(Long wagerId) throws WagerNotFoundException {
        return wagerRepository.findById(wagerId)
                .orElseThrow(() -> new WagerNotFoundException(wagerId));
    }

    /**
     * Wagers newest first. Both filters are optional.
     */
    @Transactional(readOnly = true)
    public List<Wager> findWagers(Long userId, WagerStatus status) {
        if (userId != null && status != null) {
            return wagerRepository.findByUserIdAndStatusOrderByPlacedAtDescIdDesc(userId, status);
        }
        if (userId != null) {
            return wagerRepository.findByUserIdOrderByPlacedAtDescIdDesc(userId);
        }
        if (status != null) {
            return wagerRepository.findByStatusOrderByPlacedAtDescIdDesc(status);
        }
        return wagerRepository.findAllByOrderByPlacedAtDescIdDesc();
    }

    static WagerStatus parseOutcome(String outcome) throws InvalidOutcomeException {
        if (outcome == null || outcome.isBlank()) {
            throw new InvalidOutcomeException("Settlement outcome is required");
        }
        WagerStatus status;
        try {
            status = WagerStatus.valueOf(outcome.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOutcomeException("Invalid settlement outcome: " + outcome, e);
        }
        if (!status.isTerminal()) {
            throw new InvalidOutcomeException("Invalid settlement outcome: " + outcome);
        }
        return status;
    }

    private static TransactionConflictException conflict(String operation, RuntimeException cause) {
        log.warn("Transaction conflict: operation={}, cause={}", operation, cause.getMessage());
        return new TransactionConflictException("Concurrent update conflict, retry the request: " + operation, cause);
    }
}
