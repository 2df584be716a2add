package com.nosota.wagerbook.service;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.UserNotFoundException;
import com.nosota.wagerbook.model.LedgerEntry;
import com.nosota.wagerbook.model.User;
import com.nosota.wagerbook.repository.LedgerEntryRepository;
import com.nosota.wagerbook.repository.UserRepository;
import jakarta.persistence.criteria.Predicate;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The only writer of {@link User#getBalance()}.
 *
 * <p>Every balance change is a {@link #post} call that, under the user's row lock, appends one
 * {@link LedgerEntry} and applies its amount to the balance. Both writes commit or roll back
 * together with the caller's transaction, so {@code balance == SUM(ledger_entry.amount)} holds
 * for every user at every commit.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BalanceLedgerService {

    public static final int MAX_PAGE_SIZE = 100;

    private final UserRepository userRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    /**
     * Appends a ledger entry and applies its amount to the user's balance.
     *
     * <p>Must run inside the caller's transaction. Locks the user row (a no-op if the caller
     * already holds the lock).
     *
     * @param userId      user whose balance changes
     * @param type        entry type
     * @param amount      signed amount in cents, debits negative
     * @param wagerId     related wager, null for deposits and withdrawals
     * @param description human-readable description
     * @return the persisted entry
     * @throws UserNotFoundException        if the user does not exist
     * @throws InsufficientBalanceException if the resulting balance would be negative
     */
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public LedgerEntry post(@NotNull Long userId, @NotNull LedgerEntryType type, long amount,
                            Long wagerId, @NotNull String description)
            throws UserNotFoundException, InsufficientBalanceException {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        long newBalance = user.getBalance() + amount;
        if (newBalance < 0) {
            log.warn("Rejected ledger post: userId={}, type={}, amount={}, balance={}",
                    userId, type, amount, user.getBalance());
            throw new InsufficientBalanceException(userId, user.getBalance(), -amount);
        }

        LedgerEntry entry = ledgerEntryRepository.save(LedgerEntry.builder()
                .userId(userId)
                .wagerId(wagerId)
                .type(type)
                .amount(amount)
                .description(description)
                .createdAt(Instant.now(clock))
                .build());
        user.applyLedgerDelta(amount);
        userRepository.save(user);

        log.debug("Ledger entry posted: entryId={}, userId={}, type={}, amount={}, wagerId={}, balance={}",
                entry.getId(), userId, type, amount, wagerId, user.getBalance());
        return entry;
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${wagerbook.transaction.timeout-seconds:5}")
    public LedgerEntry deposit(@NotNull Long userId, @NotNull @Positive Long amount, String description)
            throws UserNotFoundException, InsufficientBalanceException {
        log.info("Processing deposit: userId={}, amount={}", userId, amount);
        return post(userId, LedgerEntryType.DEPOSIT, amount, null,
                description != null ? description : "Deposit");
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${wagerbook.transaction.timeout-seconds:5}")
    public LedgerEntry withdraw(@NotNull Long userId, @NotNull @Positive Long amount, String description)
            throws UserNotFoundException, InsufficientBalanceException {
        log.info("Processing withdrawal: userId={}, amount={}", userId, amount);
        return post(userId, LedgerEntryType.WITHDRAWAL, -amount, null,
                description != null ? description : "Withdrawal");
    }

    @Transactional(readOnly = true)
    public long getBalance(@NotNull Long userId) throws UserNotFoundException {
        return userRepository.findById(userId)
                .map(User::getBalance)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    /**
     * Ledger entries, newest first, optionally filtered. Any filter may be null.
     */
    @Transactional(readOnly = true)
    public Page<LedgerEntry> findEntries(Long userId, LedgerEntryType type, Long wagerId, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), pageSize,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        return ledgerEntryRepository.findAll(matching(userId, type, wagerId), pageRequest);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findEntriesForWager(@NotNull Long wagerId) {
        return ledgerEntryRepository.findByWagerIdOrderByIdAsc(wagerId);
    }

    private static Specification<LedgerEntry> matching(Long userId, LedgerEntryType type, Long wagerId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (userId != null) {
                predicates.add(cb.equal(root.get("userId"), userId));
            }
            if (type != null) {
                predicates.add(cb.equal(root.get("type"), type));
            }
            if (wagerId != null) {
                predicates.add(cb.equal(root.get("wagerId"), wagerId));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
