package com.paycrypt.webhook.entity;

import com.paycrypt.shared.enums.WebhookEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One queued notification of a payment change to a client.
 *
 * Created only by WebhookEventFactory; mutated only through the guarded updates
 * in WebhookEventStore. The payload is the JSON snapshot taken at creation and
 * is re-sent unchanged on every attempt.
 *
 * Due for delivery iff status = PENDING, attempts < max_attempts and
 * next_attempt_at is null or not in the future.
 */
@Entity
@Table(name = "webhook_events",
        indexes = {
                @Index(name = "ix_webhook_events_client_id",       columnList = "client_id"),
                @Index(name = "ix_webhook_events_payment_id",      columnList = "payment_id"),
                @Index(name = "ix_webhook_events_event_type",      columnList = "event_type"),
                @Index(name = "ix_webhook_events_status",          columnList = "status"),
                @Index(name = "ix_webhook_events_next_attempt_at", columnList = "next_attempt_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "payload")
public class WebhookEvent {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final int MAX_ERROR_LENGTH     = 500;

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private Long paymentId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 50)
    private WebhookEventType eventType;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private WebhookEventStatus status = WebhookEventStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "payload", nullable = false, updatable = false, length = 65535)
    private String payload;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "last_response_code")
    private Integer lastResponseCode;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isDeliverable(Instant now) {
        if (status != WebhookEventStatus.PENDING) {
            return false;
        }
        if (attempts >= maxAttempts) {
            return false;
        }
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    /**
     * True when one more failure uses up the retry budget.
     */
    public boolean isLastAttempt() {
        return attempts + 1 >= maxAttempts;
    }

    public static String truncateError(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
