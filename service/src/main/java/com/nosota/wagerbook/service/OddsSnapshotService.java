package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.MarketType;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.error.EventNotFoundException;
import com.nosota.wagerbook.error.InvalidOddsException;
import com.nosota.wagerbook.error.LineNotFoundException;
import com.nosota.wagerbook.error.MarketNotFoundException;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import com.nosota.wagerbook.repository.EventRepository;
import com.nosota.wagerbook.repository.LineRepository;
import com.nosota.wagerbook.repository.MarketRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Event catalogue and append-only store of priced lines.
 *
 * <p>Lines are never updated: a price move is a new line with a later capturedAt.
 * Event status only moves forward (SCHEDULED, LIVE, FINAL).
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OddsSnapshotService {

    private final EventRepository eventRepository;
    private final MarketRepository marketRepository;
    private final LineRepository lineRepository;
    private final Clock clock;

    @Transactional
    public Event createEvent(@NotBlank String league, @NotBlank String homeTeam, @NotBlank String awayTeam,
                             @NotNull Instant startsAt) {
        Event event = eventRepository.save(Event.builder()
                .league(league)
                .homeTeam(homeTeam)
                .awayTeam(awayTeam)
                .startsAt(startsAt)
                .status(EventStatus.SCHEDULED)
                .build());
        log.info("Event created: eventId={}, league={}, homeTeam={}, awayTeam={}, startsAt={}",
                event.getId(), league, homeTeam, awayTeam, startsAt);
        return event;
    }

    @Transactional(readOnly = true)
    public Event getEvent(@NotNull Long eventId) throws EventNotFoundException {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    @Transactional(readOnly = true)
    public List<Event> findEvents(EventStatus status) {
        return status == null
                ? eventRepository.findAllByOrderByStartsAtAscIdAsc()
                : eventRepository.findByStatusOrderByStartsAtAscIdAsc(status);
    }

    @Transactional(rollbackFor = Exception.class)
    public Market getOrCreateMarket(@NotNull Long eventId, @NotNull MarketType type) throws EventNotFoundException {
        if (!eventRepository.existsById(eventId)) {
            throw new EventNotFoundException(eventId);
        }
        return marketRepository.findByEventIdAndType(eventId, type)
                .orElseGet(() -> {
                    Market market = marketRepository.save(Market.builder().eventId(eventId).type(type).build());
                    log.info("Market created: marketId={}, eventId={}, type={}", market.getId(), eventId, type);
                    return market;
                });
    }

    @Transactional(readOnly = true)
    public List<Market> getMarkets(@NotNull Long eventId) {
        return marketRepository.findByEventIdOrderByIdAsc(eventId);
    }

    /**
     * Appends a new quote.
     *
     * @param capturedAt capture time, defaults to now when null
     * @throws InvalidOddsException     if price is 0
     * @throws IllegalArgumentException if the selection does not belong to the market type
     */
    @Transactional(rollbackFor = Exception.class)
    public Line recordLine(@NotNull Long marketId, @NotNull Selection selection, BigDecimal point,
                           @NotNull Integer price, @NotBlank String source, Instant capturedAt)
            throws MarketNotFoundException {
        if (price == 0) {
            throw new InvalidOddsException("American odds must not be 0");
        }
        Market market = marketRepository.findById(marketId)
                .orElseThrow(() -> new MarketNotFoundException(marketId));
        if (!selection.appliesTo(market.getType())) {
            throw new IllegalArgumentException("Selection " + selection + " does not apply to "
                    + market.getType() + " market " + marketId);
        }

        Line line = lineRepository.save(Line.builder()
                .marketId(marketId)
                .selection(selection)
                .point(point)
                .price(price)
                .source(source)
                .capturedAt(capturedAt != null ? capturedAt : Instant.now(clock))
                .build());
        log.info("Line recorded: lineId={}, marketId={}, selection={}, point={}, price={}, source={}",
                line.getId(), marketId, selection, point, price, source);
        return line;
    }

    @Transactional(readOnly = true)
    public Line latestLine(@NotNull Long marketId, @NotNull Selection selection) throws LineNotFoundException {
        return lineRepository.findFirstByMarketIdAndSelectionOrderByCapturedAtDescIdDesc(marketId, selection)
                .orElseThrow(() -> new LineNotFoundException(
                        "No line for market: marketId=" + marketId + ", selection=" + selection));
    }

    /**
     * Latest quote of every selection quoted on the market.
     */
    @Transactional(readOnly = true)
    public List<Line> latestLines(@NotNull Long marketId) {
        Map<Selection, Line> latest = new EnumMap<>(Selection.class);
        for (Line line : lineRepository.findByMarketIdOrderByCapturedAtDescIdDesc(marketId)) {
            latest.putIfAbsent(line.getSelection(), line);
        }
        return new ArrayList<>(latest.values());
    }

    /**
     * Moves the event forward. Setting the current status again is a no-op.
     *
     * @throws IllegalStateException if the new status is behind the current one
     */
    @Transactional(rollbackFor = Exception.class)
    public Event updateEventStatus(@NotNull Long eventId, @NotNull EventStatus status) throws EventNotFoundException {
        Event event = getEvent(eventId);
        if (status.ordinal() < event.getStatus().ordinal()) {
            throw new IllegalStateException(String.format(
                    "Invalid event status transition: %s -> %s (eventId=%d)", event.getStatus(), status, eventId));
        }
        if (status != event.getStatus()) {
            log.info("Event status changed: eventId={}, from={}, to={}", eventId, event.getStatus(), status);
            event.setStatus(status);
        }
        return eventRepository.save(event);
    }

    /**
     * Stores the final score and marks the event FINAL. Pending wagers on it become gradable.
     */
    @Transactional(rollbackFor = Exception.class)
    public Event recordFinalScore(@NotNull Long eventId, @NotNull @PositiveOrZero Integer homeScore,
                                  @NotNull @PositiveOrZero Integer awayScore) throws EventNotFoundException {
        Event event = getEvent(eventId);
        event.setStatus(EventStatus.FINAL);
        event.setHomeScore(homeScore);
        event.setAwayScore(awayScore);
        log.info("Final score recorded: eventId={}, homeScore={}, awayScore={}", eventId, homeScore, awayScore);
        return eventRepository.save(event);
    }
}
