package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.model.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long>, JpaSpecificationExecutor<LedgerEntry> {

    @Query("SELECT COALESCE(SUM(le.amount), 0) FROM LedgerEntry le WHERE le.userId = :userId")
    Long sumAmountByUserId(@Param("userId") Long userId);

    List<LedgerEntry> findByWagerIdOrderByIdAsc(Long wagerId);

    /**
     * Net ledger movement (stakes, payouts and refunds) of a user's wagers that are no longer in
     * {@code excludedStatus}. With PENDING excluded this is the user's realized profit.
     */
    @Query("""
            SELECT COALESCE(SUM(le.amount), 0) FROM LedgerEntry le, Wager w
            WHERE le.wagerId = w.id AND w.userId = :userId AND w.status <> :excludedStatus
            """)
    Long sumWagerMovementByUserIdExcludingStatus(@Param("userId") Long userId,
                                                 @Param("excludedStatus") WagerStatus excludedStatus);

    /**
     * Full-scan reconciliation: users whose stored balance differs from the sum of their entries.
     * Each row is {@code [id, balance, ledgerSum]}.
     */
    @Query(value = """
            SELECT u.id, u.balance, COALESCE(SUM(le.amount), 0) AS ledger_sum
            FROM users u LEFT JOIN ledger_entry le ON le.user_id = u.id
            GROUP BY u.id, u.balance
            HAVING u.balance <> COALESCE(SUM(le.amount), 0)
            ORDER BY u.id
            """, nativeQuery = true)
    List<Object[]> findBalanceMismatches();
}
