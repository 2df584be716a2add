package com.nosota.wagerbook.api;

import com.nosota.wagerbook.api.dto.LedgerEntryDTO;
import com.nosota.wagerbook.api.dto.PagedResponse;
import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.request.DepositRequest;
import com.nosota.wagerbook.api.request.WithdrawalRequest;
import com.nosota.wagerbook.api.response.BalanceResponse;
import com.nosota.wagerbook.api.response.FundsResponse;
import com.nosota.wagerbook.api.response.ReconciliationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;

/**
 * WebClient-based implementation of LedgerApi for consuming the wagerbook service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 */
@RequiredArgsConstructor
@Slf4j
public class LedgerClient implements LedgerApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(Long userId, LedgerEntryType type, Long wagerId,
                                                                   int page, int size) {
        log.debug("Calling getEntries: userId={}, type={}, wagerId={}, page={}, size={}",
                userId, type, wagerId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/ledger/entries")
                        .queryParamIfPresent("userId", Optional.ofNullable(userId))
                        .queryParamIfPresent("type", Optional.ofNullable(type))
                        .queryParamIfPresent("wagerId", Optional.ofNullable(wagerId))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<LedgerEntryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long userId) {
        log.debug("Calling getBalance: userId={}", userId);

        return webClient.get()
                .uri("/api/v1/ledger/users/{userId}/balance", userId)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<FundsResponse> deposit(Long userId, DepositRequest request) {
        log.debug("Calling deposit: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri("/api/v1/ledger/users/{userId}/deposit", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(FundsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<FundsResponse> withdraw(Long userId, WithdrawalRequest request) {
        log.debug("Calling withdraw: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri("/api/v1/ledger/users/{userId}/withdraw", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(FundsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcileUser(Long userId) {
        log.debug("Calling reconcileUser: userId={}", userId);

        return webClient.get()
                .uri("/api/v1/ledger/users/{userId}/reconciliation", userId)
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<ReconciliationResponse>> reconcileAll() {
        log.debug("Calling reconcileAll");

        return webClient.get()
                .uri("/api/v1/ledger/reconciliation")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<ReconciliationResponse>>() {})
                .block();
    }
}
