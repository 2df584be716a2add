package com.nosota.wagerbook.service;

import com.nosota.wagerbook.dto.BalanceCheck;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.model.User;
import com.nosota.wagerbook.repository.LedgerEntryRepository;
import com.nosota.wagerbook.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Verifies that each user's stored balance equals the sum of their ledger entries.
 * The ledger is the source of truth; a mismatch means the balance column is wrong.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceConsistencyService {

    private final UserRepository userRepository;
    private final LedgerEntryRepository ledgerEntryRepository;

    @Transactional(readOnly = true)
    public BalanceCheck verifyUser(Long userId) throws UserNotFoundException {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        long ledgerSum = ledgerEntryRepository.sumAmountByUserId(userId);

        BalanceCheck check = new BalanceCheck(userId, user.getBalance(), ledgerSum);
        if (!check.isConsistent()) {
            log.error("Balance mismatch: userId={}, balance={}, ledgerSum={}", userId, user.getBalance(), ledgerSum);
        }
        return check;
    }

    /**
     * Full scan over all users.
     *
     * @return only the inconsistent users, empty when the ledger is sound
     */
    @Transactional(readOnly = true)
    public List<BalanceCheck> verifyAll() {
        return ledgerEntryRepository.findBalanceMismatches().stream()
                .map(row -> new BalanceCheck(
                        ((Number) row[0]).longValue(),
                        ((Number) row[1]).longValue(),
                        ((Number) row[2]).longValue()))
                .toList();
    }
}
