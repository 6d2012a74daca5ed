package com.paycrypt.webhook.service;

import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import com.paycrypt.webhook.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of webhook events.
 *
 * Concurrency: overlapping dispatch runs may select the same due event. Every
 * write is a conditional update keyed on (id, status = PENDING, attempts as read),
 * so for a given attempt exactly one caller's write lands. The losers get false
 * back and must treat the event as skipped.
 *
 *   claim          → reserves the attempt by pushing next_attempt_at to now + lease
 *   markDelivered  → PENDING → DELIVERED
 *   markFailed     → attempts + 1, then PENDING (retry per BackoffSchedule) or FAILED
 *
 * On success the passed entity is updated to the persisted values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventStore {

    private final WebhookEventRepository repository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<WebhookEvent> dueEvents(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findDue(clock.instant(), limit);
    }

    @Transactional
    public boolean claim(WebhookEvent event, Duration lease) {
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(lease);
        int updated = repository.claim(event.getId(), event.getAttempts(), now, leaseUntil);
        if (updated == 0) {
            log.debug("Claim lost for eventId={} attempts={}", event.getId(), event.getAttempts());
            return false;
        }
        event.setNextAttemptAt(leaseUntil);
        event.setUpdatedAt(now);
        return true;
    }

    @Transactional
    public boolean markDelivered(WebhookEvent event, int responseCode) {
        Instant now = clock.instant();
        int updated = repository.markDelivered(event.getId(), event.getAttempts(), responseCode, now);
        if (updated == 0) {
            log.warn("Delivered state not recorded for eventId={}: row changed concurrently", event.getId());
            return false;
        }
        event.setStatus(WebhookEventStatus.DELIVERED);
        event.setDeliveredAt(now);
        event.setLastResponseCode(responseCode);
        event.setLastError(null);
        event.setNextAttemptAt(null);
        event.setUpdatedAt(now);
        return true;
    }

    @Transactional
    public boolean markFailed(WebhookEvent event, String errorMessage) {
        return markFailed(event, errorMessage, null);
    }

    @Transactional
    public boolean markFailed(WebhookEvent event, String errorMessage, Integer responseCode) {
        Instant now = clock.instant();
        int attemptsBefore = event.getAttempts();
        boolean exhausted = event.isLastAttempt();

        WebhookEventStatus newStatus = exhausted ? WebhookEventStatus.FAILED : WebhookEventStatus.PENDING;
        Instant nextAttemptAt = exhausted ? null : BackoffSchedule.nextAttemptAt(attemptsBefore, now);
        String error = WebhookEvent.truncateError(errorMessage);

        int updated = repository.markFailed(event.getId(), WebhookEventStatus.PENDING, attemptsBefore,
                newStatus, nextAttemptAt, error, responseCode, now);
        if (updated == 0) {
            log.warn("Failed attempt not recorded for eventId={}: row changed concurrently", event.getId());
            return false;
        }
        event.setAttempts(attemptsBefore + 1);
        event.setStatus(newStatus);
        event.setNextAttemptAt(nextAttemptAt);
        event.setLastError(error);
        event.setLastResponseCode(responseCode);
        event.setUpdatedAt(now);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<WebhookEvent> findById(String id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<WebhookEvent> findByPayment(Long paymentId) {
        return repository.findByPaymentIdOrderByCreatedAtDesc(paymentId);
    }
}
