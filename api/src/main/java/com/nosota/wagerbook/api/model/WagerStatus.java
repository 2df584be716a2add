package com.nosota.wagerbook.api.model;

/**
 * Wager status in the settlement lifecycle.
 *
 * <p>PENDING is the only non-terminal state. A wager leaves it exactly once,
 * through settlement, and never changes again afterwards.
 */
public enum WagerStatus {
    /**
     * PENDING: Wager accepted, stake debited, outcome not yet known.
     */
    PENDING,

    /**
     * WON: Selection won. Stake plus profit at the accepted price is credited.
     */
    WON,

    /**
     * LOST: Selection lost. No ledger activity, the stake debit already reflects the loss.
     */
    LOST,

    /**
     * PUSH: Tied result. The original stake is refunded without profit.
     */
    PUSH,

    /**
     * VOID: Wager cancelled externally (e.g. event cancelled). Refunded like a push.
     */
    VOID;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
