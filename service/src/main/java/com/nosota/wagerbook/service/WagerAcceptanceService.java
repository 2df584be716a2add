package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.error.BettingClosedException;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.LineNotFoundException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import com.nosota.wagerbook.model.User;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.repository.EventRepository;
import com.nosota.wagerbook.repository.LineRepository;
import com.nosota.wagerbook.repository.MarketRepository;
import com.nosota.wagerbook.repository.UserRepository;
import com.nosota.wagerbook.repository.WagerRepository;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wager acceptance rule.
 *
 * <p>A wager is accepted when the line exists, its event is SCHEDULED and starts strictly more
 * than the betting cutoff from now, and the user can cover the stake. Acceptance freezes the
 * line's price and point into the wager and debits the stake through {@link BalanceLedgerService}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WagerAcceptanceService {

    private final LineRepository lineRepository;
    private final MarketRepository marketRepository;
    private final EventRepository eventRepository;
    private final UserRepository userRepository;
    private final WagerRepository wagerRepository;
    private final BalanceLedgerService balanceLedgerService;
    private final Clock clock;

    @Value("${wagerbook.betting.cutoff:PT5M}")
    private Duration bettingCutoff;

    @Transactional(rollbackFor = Exception.class, timeoutString = "${wagerbook.transaction.timeout-seconds:5}")
    public Wager placeWager(@NotNull Long userId, @NotNull Long lineId, @NotNull @Min(1) Long stakeCents)
            throws LineNotFoundException, BettingClosedException, UserNotFoundException, InsufficientBalanceException {
        log.info("Placing wager: userId={}, lineId={}, stakeCents={}", userId, lineId, stakeCents);

        Line line = lineRepository.findById(lineId)
                .orElseThrow(() -> new LineNotFoundException(lineId));
        Market market = marketRepository.findById(line.getMarketId())
                .orElseThrow(() -> new IllegalStateException("Market missing for line: lineId=" + lineId));
        Event event = eventRepository.findById(market.getEventId())
                .orElseThrow(() -> new IllegalStateException("Event missing for market: marketId=" + market.getId()));

        if (event.getStatus() != EventStatus.SCHEDULED) {
            throw new BettingClosedException("Betting is closed for this event: eventId=" + event.getId()
                    + ", status=" + event.getStatus());
        }
        Instant now = Instant.now(clock);
        if (!event.getStartsAt().isAfter(now.plus(bettingCutoff))) {
            throw new BettingClosedException("Event starts too soon to place bets: eventId=" + event.getId()
                    + ", startsAt=" + event.getStartsAt());
        }

        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        if (user.getBalance() < stakeCents) {
            throw new InsufficientBalanceException(userId, user.getBalance(), stakeCents);
        }

        Wager wager = wagerRepository.save(Wager.builder()
                .userId(userId)
                .lineId(lineId)
                .stakeCents(stakeCents)
                .acceptedPrice(line.getPrice())
                .acceptedPoint(line.getPoint())
                .status(WagerStatus.PENDING)
                .placedAt(now)
                .build());

        balanceLedgerService.post(userId, LedgerEntryType.WAGER_STAKE, -stakeCents, wager.getId(),
                String.format("Wager stake for %s vs %s - %s %s",
                        event.getHomeTeam(), event.getAwayTeam(), market.getType(), line.getSelection()));

        log.info("Wager accepted: wagerId={}, userId={}, lineId={}, stakeCents={}, acceptedPrice={}, acceptedPoint={}",
                wager.getId(), userId, lineId, stakeCents, wager.getAcceptedPrice(), wager.getAcceptedPoint());
        return wager;
    }
}
