package com.paycrypt.shared.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Webhook event types emitted to clients.
 *
 * The wire value is what clients see in the X-Paycrypt-Event header and in the
 * payload's event_type field. It is also the stored column value, so existing
 * values must never be renamed.
 */
public enum WebhookEventType {

    PAYMENT_CREATED("payment.created"),
    PAYMENT_PENDING("payment.pending"),
    PAYMENT_APPROVED("payment.approved"),
    PAYMENT_COMPLETED("payment.completed"),
    PAYMENT_FAILED("payment.failed"),
    PAYMENT_REJECTED("payment.rejected"),
    PAYMENT_CANCELLED("payment.cancelled");

    private static final Map<String, WebhookEventType> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(WebhookEventType::value, Function.identity()));

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WebhookEventType fromValue(String value) {
        WebhookEventType type = value == null ? null : BY_VALUE.get(value);
        if (type == null) {
            throw new IllegalArgumentException("Unknown webhook event type: " + value);
        }
        return type;
    }

    /**
     * Event emitted when a payment enters the given status. Empty for statuses
     * that clients are not notified about.
     */
    public static Optional<WebhookEventType> forPaymentStatus(PaymentStatus status) {
        if (status == null) {
            return Optional.empty();
        }
        return Optional.of(switch (status) {
            case PENDING   -> PAYMENT_PENDING;
            case APPROVED  -> PAYMENT_APPROVED;
            case COMPLETED -> PAYMENT_COMPLETED;
            case FAILED    -> PAYMENT_FAILED;
            case REJECTED  -> PAYMENT_REJECTED;
            case CANCELLED -> PAYMENT_CANCELLED;
        });
    }

    @Override
    public String toString() {
        return value;
    }
}
