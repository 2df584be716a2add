package com.nosota.wagerbook.model;

import com.nosota.wagerbook.api.model.WagerStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's bet against one line, frozen at acceptance time.
 *
 * <p>Stake, accepted price and accepted point never change after creation.
 * The status leaves PENDING exactly once via {@link #settle(WagerStatus, Instant)};
 * transition rules live in WagerStatusStateMachine.
 */
@Entity
@Table(name = "wager")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Wager {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "line_id", nullable = false, updatable = false)
    private Long lineId;

    @Column(name = "stake_cents", nullable = false, updatable = false)
    private Long stakeCents;

    @Column(name = "accepted_price", nullable = false, updatable = false)
    private Integer acceptedPrice;

    @Column(name = "accepted_point", precision = 7, scale = 2, updatable = false)
    private BigDecimal acceptedPoint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WagerStatus status;

    @Column(name = "placed_at", nullable = false, updatable = false)
    private Instant placedAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Version
    private Long version;

    public void settle(WagerStatus finalStatus, Instant at) {
        this.status = finalStatus;
        this.settledAt = at;
    }
}
