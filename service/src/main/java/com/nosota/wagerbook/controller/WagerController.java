package com.nosota.wagerbook.controller;

import com.nosota.wagerbook.api.WagerApi;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.api.request.PlaceWagerRequest;
import com.nosota.wagerbook.api.request.SettleWagerRequest;
import com.nosota.wagerbook.api.response.SettlementResponse;
import com.nosota.wagerbook.api.response.WagerResponse;
import com.nosota.wagerbook.dto.SettlementResult;
import com.nosota.wagerbook.mapper.LedgerEntryMapper;
import com.nosota.wagerbook.mapper.WagerMapper;
import com.nosota.wagerbook.model.Wager;
import com.nosota.wagerbook.service.WagerLedgerEngine;
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
public class WagerController implements WagerApi {

    private final WagerLedgerEngine wagerLedgerEngine;

    @Override
    public ResponseEntity<WagerResponse> placeWager(PlaceWagerRequest request) throws Exception {
        Wager wager = wagerLedgerEngine.placeWager(request.userId(), request.lineId(), request.stakeCents());
        return ResponseEntity.status(HttpStatus.CREATED).body(WagerMapper.INSTANCE.toResponse(wager));
    }

    @Override
    public ResponseEntity<SettlementResponse> settleWager(Long wagerId, SettleWagerRequest request) throws Exception {
        SettlementResult result = wagerLedgerEngine.settleWager(wagerId, request.outcome());
        return ResponseEntity.ok(new SettlementResponse(
                result.wager().getId(),
                result.wager().getUserId(),
                result.wager().getStatus(),
                result.ledgerDelta(),
                result.ledgerEntry() != null ? LedgerEntryMapper.INSTANCE.toDTO(result.ledgerEntry()) : null,
                result.balance()));
    }

    @Override
    public ResponseEntity<WagerResponse> getWager(Long wagerId) throws Exception {
        return ResponseEntity.ok(WagerMapper.INSTANCE.toResponse(wagerLedgerEngine.getWager(wagerId)));
    }

    @Override
    public ResponseEntity<List<WagerResponse>> getWagers(Long userId, WagerStatus status) {
        return ResponseEntity.ok(WagerMapper.INSTANCE.toResponseList(wagerLedgerEngine.findWagers(userId, status)));
    }
}
