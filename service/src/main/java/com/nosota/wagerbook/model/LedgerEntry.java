package com.nosota.wagerbook.model;

import com.nosota.wagerbook.api.model.LedgerEntryType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * LedgerEntry entity - an IMMUTABLE record of a balance-affecting event.
 *
 * <p>Following banking ledger standards:
 * <ul>
 *   <li>Records are append-only (no updates or deletes)</li>
 *   <li>Amounts are signed: debits negative, credits positive</li>
 *   <li>For every user, the sum of amounts equals {@link User#getBalance()}</li>
 * </ul>
 *
 * <p>Database constraints (V1.02) allow one WAGER_STAKE and at most one
 * WAGER_PAYOUT or WAGER_REFUND per wager.
 */
@Entity
@Immutable
@Table(name = "ledger_entry")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * Wager this entry belongs to. Null for DEPOSIT and WITHDRAWAL.
     */
    @Column(name = "wager_id")
    private Long wagerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LedgerEntryType type;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
