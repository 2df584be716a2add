package com.nosota.wagerbook.repository;

import com.nosota.wagerbook.api.model.EventStatus;
import com.nosota.wagerbook.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EventRepository extends JpaRepository<Event, Long> {
    List<Event> findAllByOrderByStartsAtAscIdAsc();

    List<Event> findByStatusOrderByStartsAtAscIdAsc(EventStatus status);
}
