package com.nosota.wagerbook.api;

import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.api.request.PlaceWagerRequest;
import com.nosota.wagerbook.api.request.SettleWagerRequest;
import com.nosota.wagerbook.api.response.SettlementResponse;
import com.nosota.wagerbook.api.response.WagerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;

/**
 * WebClient-based implementation of WagerApi for consuming the wagerbook service.
 *
 * <p>Used by the grading trigger (operator tooling) and the presentation layer.
 * Error statuses surface as {@link org.springframework.web.reactive.function.client.WebClientResponseException};
 * a 409 with code TRANSACTION_CONFLICT is the only one worth retrying.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Bean
 * public WagerClient wagerClient(WebClient.Builder builder,
 *                                @Value("${services.wagerbook.url}") String baseUrl) {
 *     return new WagerClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class WagerClient implements WagerApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<WagerResponse> placeWager(PlaceWagerRequest request) {
        log.debug("Calling placeWager: userId={}, lineId={}, stakeCents={}",
                request.userId(), request.lineId(), request.stakeCents());

        return webClient.post()
                .uri("/api/v1/wagers")
                .bodyValue(request)
                .retrieve()
                .toEntity(WagerResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> settleWager(Long wagerId, SettleWagerRequest request) {
        log.debug("Calling settleWager: wagerId={}, outcome={}", wagerId, request.outcome());

        return webClient.post()
                .uri("/api/v1/wagers/{wagerId}/settle", wagerId)
                .bodyValue(request)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WagerResponse> getWager(Long wagerId) {
        log.debug("Calling getWager: wagerId={}", wagerId);

        return webClient.get()
                .uri("/api/v1/wagers/{wagerId}", wagerId)
                .retrieve()
                .toEntity(WagerResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<WagerResponse>> getWagers(Long userId, WagerStatus status) {
        log.debug("Calling getWagers: userId={}, status={}", userId, status);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/wagers")
                        .queryParamIfPresent("userId", Optional.ofNullable(userId))
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<WagerResponse>>() {})
                .block();
    }
}
