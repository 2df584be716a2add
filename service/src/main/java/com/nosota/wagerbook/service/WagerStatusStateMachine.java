package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.dto.SettlementEffect;
import com.nosota.wagerbook.error.AlreadySettledException;
import com.nosota.wagerbook.error.InvalidOutcomeException;
import com.nosota.wagerbook.model.Wager;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for wager settlement.
 *
 * <p>State diagram:
 * <pre>
 *             PENDING
 *                |
 *     +------+---+---+------+
 *     |      |       |      |
 *    WON   LOST    PUSH   VOID
 * </pre>
 *
 * <p>Every final state is immutable. Each transition implies exactly one ledger effect:
 * <ul>
 *   <li>WON: WAGER_PAYOUT of stake + profit at the accepted price</li>
 *   <li>LOST: nothing, the stake was debited at acceptance</li>
 *   <li>PUSH, VOID: WAGER_REFUND of the stake</li>
 * </ul>
 */
@Component
public class WagerStatusStateMachine {

    private static final Map<WagerStatus, Set<WagerStatus>> ALLOWED_TRANSITIONS = Map.of(
            WagerStatus.PENDING, EnumSet.of(
                    WagerStatus.WON,
                    WagerStatus.LOST,
                    WagerStatus.PUSH,
                    WagerStatus.VOID
            )
    );

    public boolean isTransitionAllowed(WagerStatus fromStatus, WagerStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<WagerStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Checks that {@code outcome} is a settlement outcome and the wager can still take it.
     *
     * @throws InvalidOutcomeException if outcome is null or PENDING
     * @throws AlreadySettledException if the wager is already in a final state
     */
    public void validateTransition(Long wagerId, WagerStatus fromStatus, WagerStatus outcome)
            throws InvalidOutcomeException, AlreadySettledException {
        if (outcome == null || !outcome.isTerminal()) {
            throw new InvalidOutcomeException("Invalid settlement outcome: " + outcome
                    + ". Allowed: " + getAllowedTransitions(WagerStatus.PENDING));
        }
        if (isFinalState(fromStatus)) {
            throw new AlreadySettledException(wagerId, fromStatus);
        }
        if (!isTransitionAllowed(fromStatus, outcome)) {
            throw new IllegalStateException(String.format(
                    "Invalid wager status transition: %s -> %s", fromStatus, outcome));
        }
    }

    /**
     * Validates the transition and computes its ledger effect. Does not mutate the wager.
     */
    public SettlementEffect transition(Wager wager, WagerStatus outcome)
            throws InvalidOutcomeException, AlreadySettledException {
        validateTransition(wager.getId(), wager.getStatus(), outcome);

        switch (outcome) {
            case WON -> {
                return SettlementEffect.credit(WagerStatus.WON, LedgerEntryType.WAGER_PAYOUT,
                        PayoutCalculator.calculatePayout(wager.getStakeCents(), wager.getAcceptedPrice()));
            }
            case LOST -> {
                return SettlementEffect.none(WagerStatus.LOST);
            }
            case PUSH, VOID -> {
                return SettlementEffect.credit(outcome, LedgerEntryType.WAGER_REFUND, wager.getStakeCents());
            }
            default -> throw new InvalidOutcomeException("Not a settlement outcome: " + outcome);
        }
    }

    public boolean isFinalState(WagerStatus status) {
        return status != null && status.isTerminal();
    }

    public Set<WagerStatus> getAllowedTransitions(WagerStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
