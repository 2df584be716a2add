package com.nosota.wagerbook.controller;

import com.nosota.wagerbook.api.OddsApi;
import com.nosota.wagerbook.api.dto.LineDTO;
import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.api.request.CreateEventRequest;
import com.nosota.wagerbook.api.request.CreateMarketRequest;
import com.nosota.wagerbook.api.request.RecordLineRequest;
import com.nosota.wagerbook.api.request.RecordResultRequest;
import com.nosota.wagerbook.api.request.UpdateEventStatusRequest;
import com.nosota.wagerbook.api.response.EventResponse;
import com.nosota.wagerbook.api.response.MarketResponse;
import com.nosota.wagerbook.mapper.LineMapper;
import com.nosota.wagerbook.model.Event;
import com.nosota.wagerbook.model.Line;
import com.nosota.wagerbook.model.Market;
import com.nosota.wagerbook.service.OddsSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class OddsController implements OddsApi {

    private final OddsSnapshotService oddsSnapshotService;

    @Override
    public ResponseEntity<EventResponse> createEvent(CreateEventRequest request) {
        Event event = oddsSnapshotService.createEvent(
                request.league(), request.homeTeam(), request.awayTeam(), request.startsAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(toEventResponse(event));
    }

    @Override
    public ResponseEntity<List<EventResponse>> getEvents(EventStatus status) {
        return ResponseEntity.ok(oddsSnapshotService.findEvents(status).stream()
                .map(this::toEventResponse)
                .toList());
    }

    @Override
    public ResponseEntity<MarketResponse> createMarket(Long eventId, CreateMarketRequest request) throws Exception {
        Market market = oddsSnapshotService.getOrCreateMarket(eventId, request.type());
        return ResponseEntity.status(HttpStatus.CREATED).body(toMarketResponse(market));
    }

    @Override
    public ResponseEntity<LineDTO> recordLine(Long marketId, RecordLineRequest request) throws Exception {
        Line line = oddsSnapshotService.recordLine(marketId, request.selection(), request.point(),
                request.price(), request.source(), request.capturedAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(LineMapper.INSTANCE.toDTO(line));
    }

    @Override
    public ResponseEntity<LineDTO> getLatestLine(Long marketId, Selection selection) throws Exception {
        return ResponseEntity.ok(LineMapper.INSTANCE.toDTO(oddsSnapshotService.latestLine(marketId, selection)));
    }

    @Override
    public ResponseEntity<EventResponse> updateEventStatus(Long eventId, UpdateEventStatusRequest request)
            throws Exception {
        return ResponseEntity.ok(toEventResponse(oddsSnapshotService.updateEventStatus(eventId, request.status())));
    }

    @Override
    public ResponseEntity<EventResponse> recordResult(Long eventId, RecordResultRequest request) throws Exception {
        Event event = oddsSnapshotService.recordFinalScore(eventId, request.homeScore(), request.awayScore());
        return ResponseEntity.ok(toEventResponse(event));
    }

    private EventResponse toEventResponse(Event event) {
        List<MarketResponse> markets = oddsSnapshotService.getMarkets(event.getId()).stream()
                .map(this::toMarketResponse)
                .toList();
        return new EventResponse(event.getId(), event.getLeague(), event.getHomeTeam(), event.getAwayTeam(),
                event.getStartsAt(), event.getStatus(), event.getHomeScore(), event.getAwayScore(), markets);
    }

    private MarketResponse toMarketResponse(Market market) {
        return new MarketResponse(market.getId(), market.getEventId(), market.getType(),
                LineMapper.INSTANCE.toDTOList(oddsSnapshotService.latestLines(market.getId())));
    }
}
