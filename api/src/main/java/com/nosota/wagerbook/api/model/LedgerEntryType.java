package com.nosota.wagerbook.api.model;

/**
 * Type of balance-affecting event recorded in the ledger.
 */
public enum LedgerEntryType {
    /** Stake debited when a wager is accepted (negative amount). */
    WAGER_STAKE,
    /** Stake plus profit credited for a won wager. */
    WAGER_PAYOUT,
    /** Stake returned for a pushed or voided wager. */
    WAGER_REFUND,
    /** Points added from outside the wager flow. */
    DEPOSIT,
    /** Points removed from outside the wager flow (negative amount). */
    WITHDRAWAL
}
