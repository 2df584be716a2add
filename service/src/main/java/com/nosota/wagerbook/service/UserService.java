package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.api.response.UserStatisticsResponse;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.model.User;
import com.nosota.wagerbook.repository.LedgerEntryRepository;
import com.nosota.wagerbook.repository.UserRepository;
import com.nosota.wagerbook.repository.WagerRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final WagerRepository wagerRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final BalanceLedgerService balanceLedgerService;
    private final Clock clock;

    @Value("${wagerbook.users.default-initial-balance:10000}")
    private long defaultInitialBalance;

    /**
     * Creates a user. A non-zero opening balance is booked as a DEPOSIT entry, so the balance is
     * backed by the ledger from the first row.
     *
     * @param initialBalance opening balance in cents, null for the configured default
     */
    @Transactional(rollbackFor = Exception.class)
    public User createUser(@NotBlank String displayName, @PositiveOrZero Long initialBalance)
            throws UserNotFoundException, InsufficientBalanceException {
        long openingBalance = initialBalance != null ? initialBalance : defaultInitialBalance;

        User user = userRepository.save(User.builder()
                .displayName(displayName)
                .balance(0L)
                .createdAt(Instant.now(clock))
                .build());
        if (openingBalance > 0) {
            balanceLedgerService.post(user.getId(), LedgerEntryType.DEPOSIT, openingBalance, null, "Opening balance");
        }

        log.info("User created: userId={}, displayName={}, openingBalance={}", user.getId(), displayName, openingBalance);
        return user;
    }

    @Transactional(readOnly = true)
    public User getUser(@NotNull Long userId) throws UserNotFoundException {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    @Transactional(readOnly = true)
    public List<User> getUsers() {
        return userRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    /**
     * Wager statistics. Net profit counts only settled wagers; win rate is WON / (WON + LOST).
     */
    @Transactional(readOnly = true)
    public UserStatisticsResponse getStatistics(@NotNull Long userId) throws UserNotFoundException {
        User user = getUser(userId);

        Map<WagerStatus, Long> counts = new EnumMap<>(WagerStatus.class);
        long totalWagers = 0;
        long totalStaked = 0;
        for (Object[] row : wagerRepository.summarizeByStatus(userId)) {
            long count = ((Number) row[1]).longValue();
            counts.put((WagerStatus) row[0], count);
            totalWagers += count;
            totalStaked += row[2] != null ? ((Number) row[2]).longValue() : 0L;
        }
        long won = counts.getOrDefault(WagerStatus.WON, 0L);
        long lost = counts.getOrDefault(WagerStatus.LOST, 0L);
        long decided = won + lost;
        double winRate = decided > 0 ? (double) won / decided : 0.0;

        long netProfit = ledgerEntryRepository.sumWagerMovementByUserIdExcludingStatus(userId, WagerStatus.PENDING);

        return new UserStatisticsResponse(
                user.getId(),
                user.getDisplayName(),
                user.getBalance(),
                totalWagers,
                counts.getOrDefault(WagerStatus.PENDING, 0L),
                won,
                lost,
                counts.getOrDefault(WagerStatus.PUSH, 0L),
                counts.getOrDefault(WagerStatus.VOID, 0L),
                totalStaked,
                netProfit,
                winRate
        );
    }
}
