package com.nosota.wagerbook.api.request;

/**
 * Request for grading a pending wager.
 *
 * <p>The outcome is kept as a string so that values outside WON, LOST, PUSH and VOID
 * reach the service and are reported as an invalid outcome rather than a parse error.
 * A missing or blank outcome is reported the same way.
 *
 * @param outcome One of WON, LOST, PUSH, VOID
 */
public record SettleWagerRequest(
        String outcome
) {
}
