package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.error.AlreadySettledException;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.repository.EventRepository;
import com.nosota.wagerbook.repository.LineRepository;
import com.nosota.wagerbook.repository.MarketRepository;
import com.nosota.wagerbook.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Grades pending wagers on finished events and settles them through {@link WagerLedgerEngine}.
 *
 * <p>Each wager settles in its own transaction. A wager settled concurrently by a manual call is
 * skipped; any other failure is logged and the sweep moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradingSweepService {

    private final WagerRepository wagerRepository;
    private final LineRepository lineRepository;
    private final MarketRepository marketRepository;
    private final EventRepository eventRepository;
    private final WagerGrader wagerGrader;
    private final WagerLedgerEngine wagerLedgerEngine;

    /**
     * @return number of wagers settled by this run
     */
    public int gradeFinishedEvents() {
        List<Long> wagerIds = wagerRepository.findIdsToGrade(WagerStatus.PENDING, EventStatus.FINAL);
        if (wagerIds.isEmpty()) {
            return 0;
        }
        log.info("Grading sweep found pending wagers: count={}", wagerIds.size());

        int settled = 0;
        for (Long wagerId : wagerIds) {
            try {
                WagerStatus outcome = gradeWager(wagerId);
                wagerLedgerEngine.settleWager(wagerId, outcome);
                settled++;
            } catch (AlreadySettledException e) {
                log.info("Wager already settled, skipping: wagerId={}, status={}", wagerId, e.getExistingStatus());
            } catch (Exception e) {
                log.error("Failed to grade wager: wagerId={}, error={}", wagerId, e.getMessage(), e);
            }
        }
        return settled;
    }

    private WagerStatus gradeWager(Long wagerId) {
        Wager wager = wagerRepository.findById(wagerId)
                .orElseThrow(() -> new IllegalStateException("Wager disappeared: wagerId=" + wagerId));
        Line line = lineRepository.findById(wager.getLineId())
                .orElseThrow(() -> new IllegalStateException("Line missing: lineId=" + wager.getLineId()));
        Market market = marketRepository.findById(line.getMarketId())
                .orElseThrow(() -> new IllegalStateException("Market missing: marketId=" + line.getMarketId()));
        Event event = eventRepository.findById(market.getEventId())
                .orElseThrow(() -> new IllegalStateException("Event missing: eventId=" + market.getEventId()));
        return wagerGrader.grade(wager, line, market, event);
    }
}
