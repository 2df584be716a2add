package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.api.model.WagerStatus;
import com.nosota.wagerbook.model.Wager;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WagerRepository extends JpaRepository<Wager, Long> {
    /**
     * Retrieves the {@link Wager} with the given ID and locks the row for update.
     * <p>
     * Settlement reads the status under this lock, so of two concurrent settlements of the same
     * wager the second one observes the first one's committed status.
     * </p>
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wager w WHERE w.id = :id")
    Optional<Wager> findByIdForUpdate(@Param("id") Long id);

    List<Wager> findAllByOrderByPlacedAtDescIdDesc();

    List<Wager> findByUserIdOrderByPlacedAtDescIdDesc(Long userId);

    List<Wager> findByStatusOrderByPlacedAtDescIdDesc(WagerStatus status);

    List<Wager> findByUserIdAndStatusOrderByPlacedAtDescIdDesc(Long userId, WagerStatus status);

    /**
     * IDs of wagers in {@code wagerStatus} whose event is in {@code eventStatus} and has both
     * scores recorded. Used by the grading sweep with PENDING / FINAL.
     */
    @Query("""
            SELECT w.id FROM Wager w, Line l, Market m, Event e
            WHERE w.lineId = l.id AND l.marketId = m.id AND m.eventId = e.id
              AND w.status = :wagerStatus AND e.status = :eventStatus
              AND e.homeScore IS NOT NULL AND e.awayScore IS NOT NULL
            ORDER BY w.id
            """)
    List<Long> findIdsToGrade(@Param("wagerStatus") WagerStatus wagerStatus,
                              @Param("eventStatus") EventStatus eventStatus);

    /**
     * Per-status wager count and staked total for a user.
     * Each row is {@code [WagerStatus status, Long count, Long stakeSum]}.
     */
    @Query("SELECT w.status, COUNT(w), SUM(w.stakeCents) FROM Wager w WHERE w.userId = :userId GROUP BY w.status")
    List<Object[]> summarizeByStatus(@Param("userId") Long userId);
}
