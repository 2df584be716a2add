package com.nosota.wagerbook.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Bettor account.
 *
 * <p>{@code balance} is a materialized total of the user's ledger entries. It has no setter:
 * the only way to change it is {@link #applyLedgerDelta(long)}, which BalanceLedgerService calls
 * in the same transaction that appends the justifying ledger entry.
 */
@Entity
@Table(name = "users")
@Getter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Setter
    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    /**
     * Current balance in cents. Never negative (CHECK constraint in V1.02).
     */
    @Column(nullable = false)
    private Long balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public void applyLedgerDelta(long delta) {
        this.balance = this.balance + delta;
    }
}
