package com.nosota.wagerbook.model;

import com.nosota.wagerbook.api.model.Selection;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Line entity - an IMMUTABLE price quote for one selection of a market.
 *
 * <p>A re-quote is a new row. Wagers copy price and point at acceptance,
 * so later lines never affect an accepted wager.
 */
@Entity
@Immutable
@Table(name = "line")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Line {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "market_id", nullable = false)
    private Long marketId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Selection selection;

    /**
     * Spread or total value. Null for moneyline quotes.
     */
    @Column(precision = 7, scale = 2)
    private BigDecimal point;

    /**
     * American odds. Never 0.
     */
    @Column(nullable = false)
    private Integer price;

    @Column(nullable = false)
    private String source;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;
}
