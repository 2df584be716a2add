package com.nosota.wagerbook.scheduler;

import com.nosota.wagerbook.service.GradingSweepService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically settles pending wagers on events with a recorded final score.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   grading-sweep:
 *     enabled: true              # enable/disable scheduler
 *     cron: "0 *&#47;5 * * * *"      # every 5 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.grading-sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class GradingSweepScheduler {

    private final GradingSweepService gradingSweepService;

    @Scheduled(cron = "${scheduler.grading-sweep.cron:0 */5 * * * *}")
    public void gradeFinishedEvents() {
        log.debug("Starting scheduled job: grading sweep");

        try {
            int settledCount = gradingSweepService.gradeFinishedEvents();

            if (settledCount > 0) {
                log.info("Grading sweep settled {} wagers", settledCount);
            } else {
                log.debug("No gradable wagers found");
            }

        } catch (Exception e) {
            log.error("Grading sweep failed: {}", e.getMessage(), e);
        }
    }
}
