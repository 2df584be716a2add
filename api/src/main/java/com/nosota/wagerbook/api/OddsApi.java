package com.nosota.wagerbook.api;

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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Odds API interface used by the odds ingestion job and the admin screens.
 *
 * <p>Lines are append-only: a new quote is always a new line, existing lines are never changed.
 */
@RequestMapping("/api/v1/odds")
public interface OddsApi {

    @PostMapping("/events")
    ResponseEntity<EventResponse> createEvent(@RequestBody @Valid CreateEventRequest request);

    /**
     * Lists events ordered by start time, each with its markets and latest lines.
     */
    @GetMapping("/events")
    ResponseEntity<List<EventResponse>> getEvents(
            @RequestParam(value = "status", required = false) EventStatus status);

    @PostMapping("/events/{eventId}/markets")
    ResponseEntity<MarketResponse> createMarket(
            @PathVariable("eventId") Long eventId,
            @RequestBody @Valid CreateMarketRequest request) throws Exception;

    @PostMapping("/markets/{marketId}/lines")
    ResponseEntity<LineDTO> recordLine(
            @PathVariable("marketId") Long marketId,
            @RequestBody @Valid RecordLineRequest request) throws Exception;

    @GetMapping("/markets/{marketId}/lines/latest")
    ResponseEntity<LineDTO> getLatestLine(
            @PathVariable("marketId") Long marketId,
            @RequestParam("selection") Selection selection) throws Exception;

    /**
     * Moves an event forward in its lifecycle (SCHEDULED, LIVE, FINAL).
     */
    @PutMapping("/events/{eventId}/status")
    ResponseEntity<EventResponse> updateEventStatus(
            @PathVariable("eventId") Long eventId,
            @RequestBody @Valid UpdateEventStatusRequest request) throws Exception;

    /**
     * Records the final score and marks the event FINAL.
     */
    @PostMapping("/events/{eventId}/result")
    ResponseEntity<EventResponse> recordResult(
            @PathVariable("eventId") Long eventId,
            @RequestBody @Valid RecordResultRequest request) throws Exception;
}
