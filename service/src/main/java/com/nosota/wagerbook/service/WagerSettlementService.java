package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.dto.SettlementEffect;
import com.nosota.wagerbook.dto.SettlementResult;
import com.nosota.wagerbook.error.AlreadySettledException;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.InvalidOutcomeException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.error.WagerNotFoundException;
import com.nosota.wagerbook.model.LedgerEntry;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.repository.WagerRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a grading decision to a pending wager.
 *
 * <p>Locks the wager row, asks {@link WagerStatusStateMachine} for the transition's effect, then
 * writes the new status and the effect's ledger entry in one transaction. Locks are taken
 * wager first, then user.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WagerSettlementService {

    private final WagerRepository wagerRepository;
    private final WagerStatusStateMachine stateMachine;
    private final BalanceLedgerService balanceLedgerService;
    private final Clock clock;

    @Transactional(rollbackFor = Exception.class, timeoutString = "${wagerbook.transaction.timeout-seconds:5}")
    public SettlementResult settleWager(@NotNull Long wagerId, WagerStatus outcome)
            throws WagerNotFoundException, AlreadySettledException, InvalidOutcomeException,
            UserNotFoundException, InsufficientBalanceException {
        log.info("Settling wager: wagerId={}, outcome={}", wagerId, outcome);

        Wager wager = wagerRepository.findByIdForUpdate(wagerId)
                .orElseThrow(() -> new WagerNotFoundException(wagerId));

        SettlementEffect effect = stateMachine.transition(wager, outcome);

        wager.settle(effect.status(), Instant.now(clock));
        wagerRepository.save(wager);

        LedgerEntry entry = null;
        if (effect.hasLedgerEntry()) {
            entry = balanceLedgerService.post(wager.getUserId(), effect.entryType(), effect.amount(),
                    wager.getId(), describe(wager.getId(), effect));
        }
        long balance = balanceLedgerService.getBalance(wager.getUserId());

        log.info("Wager settled: wagerId={}, userId={}, status={}, ledgerDelta={}, balance={}",
                wagerId, wager.getUserId(), effect.status(), effect.amount(), balance);
        return new SettlementResult(wager, entry, effect.amount(), balance);
    }

    private static String describe(Long wagerId, SettlementEffect effect) {
        if (effect.entryType() == LedgerEntryType.WAGER_PAYOUT) {
            return "Payout for winning wager " + wagerId;
        }
        return effect.status() == WagerStatus.PUSH
                ? "Refund for pushed wager " + wagerId
                : "Refund for voided wager " + wagerId;
    }
}
