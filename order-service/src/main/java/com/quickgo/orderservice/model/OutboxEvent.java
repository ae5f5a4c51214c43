package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification waiting to be relayed to the broker. Written in the same transaction as the
 * order change that caused it; {@link com.quickgo.orderservice.job.OutboxPublisher} drains it.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_pending", columnList = "processed, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

  private static final int MAX_ERROR_LENGTH = 500;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  // ORDER; aggregateId is the order id
  @Column(name = "aggregate_type", nullable = false, length = 16)
  private String aggregateType;

  @Column(name = "aggregate_id", nullable = false)
  private String aggregateId;

  // routing key, notification.<event>
  @Column(name = "routing_key", nullable = false)
  private String type;

  @Column(columnDefinition = "jsonb", nullable = false)
  @JdbcTypeCode(SqlTypes.JSON)
  private String payload;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private boolean processed;

  @Column(name = "published_at")
  private Instant publishedAt;

  @Column(nullable = false)
  private int attempts;

  @Column(name = "last_error", length = MAX_ERROR_LENGTH)
  private String lastError;

  public void markPublished(Instant at) {
    this.processed = true;
    this.publishedAt = at;
    this.lastError = null;
  }

  public void recordFailure(Exception e) {
    this.attempts++;
    String message = e.getClass().getSimpleName() + ": " + e.getMessage();
    this.lastError = message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
  }
}
