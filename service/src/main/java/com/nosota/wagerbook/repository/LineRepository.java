package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.api.model.Selection;
import com.nosota.wagerbook.model.Line;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LineRepository extends JpaRepository<Line, Long> {
    /**
     * Latest quote for one selection. Ties on capturedAt are broken by the later insert.
     */
    Optional<Line> findFirstByMarketIdAndSelectionOrderByCapturedAtDescIdDesc(Long marketId, Selection selection);

    List<Line> findByMarketIdOrderByCapturedAtDescIdDesc(Long marketId);
}
