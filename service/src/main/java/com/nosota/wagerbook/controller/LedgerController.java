package com.nosota.wagerbook.controller;

import com.nosota.wagerbook.api.LedgerApi;
import com.nosota.wagerbook.api.dto.LedgerEntryDTO;
import com.nosota.wagerbook.api.dto.PagedResponse;
import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.request.DepositRequest;
import com.nosota.wagerbook.api.request.WithdrawalRequest;
import com.nosota.wagerbook.api.response.BalanceResponse;
import com.nosota.wagerbook.api.response.FundsResponse;
import com.nosota.wagerbook.api.response.ReconciliationResponse;
import com.nosota.wagerbook.dto.BalanceCheck;
import com.nosota.wagerbook.mapper.LedgerEntryMapper;
import com.nosota.wagerbook.model.LedgerEntry;
import com.nosota.wagerbook.service.BalanceConsistencyService;
import com.nosota.wagerbook.service.BalanceLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class LedgerController implements LedgerApi {

    private final BalanceLedgerService balanceLedgerService;
    private final BalanceConsistencyService balanceConsistencyService;

    @Override
    public ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(Long userId, LedgerEntryType type, Long wagerId,
                                                                    int page, int size) {
        Page<LedgerEntry> entries = balanceLedgerService.findEntries(userId, type, wagerId, page, size);
        return ResponseEntity.ok(new PagedResponse<>(
                LedgerEntryMapper.INSTANCE.toDTOList(entries.getContent()),
                entries.getNumber(),
                entries.getSize(),
                entries.getTotalElements()));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long userId) throws Exception {
        return ResponseEntity.ok(new BalanceResponse(userId, balanceLedgerService.getBalance(userId)));
    }

    @Override
    public ResponseEntity<FundsResponse> deposit(Long userId, DepositRequest request) throws Exception {
        LedgerEntry entry = balanceLedgerService.deposit(userId, request.amount(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(funds(userId, entry));
    }

    @Override
    public ResponseEntity<FundsResponse> withdraw(Long userId, WithdrawalRequest request) throws Exception {
        LedgerEntry entry = balanceLedgerService.withdraw(userId, request.amount(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(funds(userId, entry));
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcileUser(Long userId) throws Exception {
        return ResponseEntity.ok(toResponse(balanceConsistencyService.verifyUser(userId)));
    }

    @Override
    public ResponseEntity<List<ReconciliationResponse>> reconcileAll() {
        return ResponseEntity.ok(balanceConsistencyService.verifyAll().stream()
                .map(LedgerController::toResponse)
                .toList());
    }

    private FundsResponse funds(Long userId, LedgerEntry entry) throws Exception {
        return new FundsResponse(userId, LedgerEntryMapper.INSTANCE.toDTO(entry), balanceLedgerService.getBalance(userId));
    }

    private static ReconciliationResponse toResponse(BalanceCheck check) {
        return new ReconciliationResponse(check.userId(), check.balance(), check.ledgerSum(), check.isConsistent());
    }
}
