package com.nosota.wagerbook.scheduler;

import com.nosota.wagerbook.dto.BalanceCheck;
import com.nosota.wagerbook.service.BalanceConsistencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic full reconciliation of user balances against the ledger.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   balance-audit:
 *     enabled: true              # enable/disable scheduler
 *     cron: "0 *&#47;15 * * * *"     # every 15 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.balance-audit.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BalanceAuditScheduler {

    private final BalanceConsistencyService balanceConsistencyService;

    @Scheduled(cron = "${scheduler.balance-audit.cron:0 */15 * * * *}")
    public void auditBalances() {
        log.debug("Starting scheduled job: balance audit");

        try {
            List<BalanceCheck> mismatches = balanceConsistencyService.verifyAll();

            if (mismatches.isEmpty()) {
                log.debug("Balance audit passed");
                return;
            }
            for (BalanceCheck mismatch : mismatches) {
                log.error("Balance audit mismatch: userId={}, balance={}, ledgerSum={}",
                        mismatch.userId(), mismatch.balance(), mismatch.ledgerSum());
            }
            log.error("Balance audit found {} inconsistent users", mismatches.size());

        } catch (Exception e) {
            log.error("Balance audit failed: {}", e.getMessage(), e);
        }
    }
}
