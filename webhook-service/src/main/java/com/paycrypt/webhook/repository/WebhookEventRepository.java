package com.paycrypt.webhook.repository;

import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Every state-changing query here is conditional on the row still being PENDING
 * with the attempts value the caller read. A return value of 0 means another
 * dispatcher got there first and nothing was written.
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, String> {

    @Query("""
            SELECT e FROM WebhookEvent e
             WHERE e.status = :pending
               AND e.attempts < e.maxAttempts
               AND (e.nextAttemptAt IS NULL OR e.nextAttemptAt <= :now)
             ORDER BY e.createdAt ASC, e.id ASC
            """)
    List<WebhookEvent> findDue(WebhookEventStatus pending, Instant now, Pageable page);

    default List<WebhookEvent> findDue(Instant now, int limit) {
        return findDue(WebhookEventStatus.PENDING, now, PageRequest.of(0, limit));
    }

    List<WebhookEvent> findByPaymentIdOrderByCreatedAtDesc(Long paymentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WebhookEvent e
               SET e.nextAttemptAt = :leaseUntil,
                   e.updatedAt     = :now
             WHERE e.id = :id
               AND e.status = :pending
               AND e.attempts = :expectedAttempts
               AND e.attempts < e.maxAttempts
               AND (e.nextAttemptAt IS NULL OR e.nextAttemptAt <= :now)
            """)
    int claim(String id, WebhookEventStatus pending, int expectedAttempts, Instant now, Instant leaseUntil);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WebhookEvent e
               SET e.status           = :delivered,
                   e.deliveredAt      = :now,
                   e.lastResponseCode = :responseCode,
                   e.lastError        = NULL,
                   e.nextAttemptAt    = NULL,
                   e.updatedAt        = :now
             WHERE e.id = :id
               AND e.status = :pending
               AND e.attempts = :expectedAttempts
            """)
    int markDelivered(String id, WebhookEventStatus pending, WebhookEventStatus delivered,
                      int expectedAttempts, Integer responseCode, Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE WebhookEvent e
               SET e.attempts         = e.attempts + 1,
                   e.status           = :newStatus,
                   e.nextAttemptAt    = :nextAttemptAt,
                   e.lastError        = :error,
                   e.lastResponseCode = :responseCode,
                   e.updatedAt        = :now
             WHERE e.id = :id
               AND e.status = :pending
               AND e.attempts = :expectedAttempts
            """)
    int markFailed(String id, WebhookEventStatus pending, int expectedAttempts, WebhookEventStatus newStatus,
                   Instant nextAttemptAt, String error, Integer responseCode, Instant now);

    default int claim(String id, int expectedAttempts, Instant now, Instant leaseUntil) {
        return claim(id, WebhookEventStatus.PENDING, expectedAttempts, now, leaseUntil);
    }

    default int markDelivered(String id, int expectedAttempts, Integer responseCode, Instant now) {
        return markDelivered(id, WebhookEventStatus.PENDING, WebhookEventStatus.DELIVERED,
                expectedAttempts, responseCode, now);
    }
}
