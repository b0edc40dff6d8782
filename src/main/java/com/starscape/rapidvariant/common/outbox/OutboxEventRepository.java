package com.starscape.rapidvariant.common.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {
    
    @Query("SELECT e FROM OutboxEvent e WHERE e.processedAt IS NULL AND e.eventType = :eventType ORDER BY e.occurredAt ASC")
    List<OutboxEvent> findUnprocessedByType(@Param("eventType") String eventType, Pageable page);
    
    List<OutboxEvent> findByAggregateId(String aggregateId);
}
