package com.nosota.wagerbook.api.response;

/**
 * Ledger-balance equality check for one user.
 *
 * @param balance    Materialized balance on the user row
 * @param ledgerSum  Sum of all ledger entry amounts of the user
 * @param consistent True when both are equal
 */
public record ReconciliationResponse(
        Long userId,
        Long balance,
        Long ledgerSum,
        boolean consistent
) {}
