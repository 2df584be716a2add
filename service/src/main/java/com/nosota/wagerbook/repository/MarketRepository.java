package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.api.model.MarketType;
import com.nosota.wagerbook.model.Market;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MarketRepository extends JpaRepository<Market, Long> {
    /**
     * An event has at most one market per type (unique constraint uq_market_event_type).
     */
    Optional<Market> findByEventIdAndType(Long eventId, MarketType type);

    List<Market> findByEventIdOrderByIdAsc(Long eventId);
}
