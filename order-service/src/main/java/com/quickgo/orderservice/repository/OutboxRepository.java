package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

  // oldest first, skipping rows parked after too many failed sends
  List<OutboxEvent> findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(int maxAttempts);

  List<OutboxEvent> findTop1000ByProcessedTrueAndPublishedAtBefore(Instant cutoff);

  long countByProcessedFalseAndAttemptsGreaterThanEqual(int maxAttempts);

  List<OutboxEvent> findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(String aggregateType, String aggregateId);
}
