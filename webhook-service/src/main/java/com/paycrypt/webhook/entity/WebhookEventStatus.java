package com.paycrypt.webhook.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivery state of a webhook event.
 *
 * Lifecycle: PENDING → DELIVERED (2xx received)
 *            PENDING → FAILED    (max_attempts exhausted)
 * Both end states are terminal.
 */
public enum WebhookEventStatus {

    PENDING("pending"),
    DELIVERED("delivered"),
    FAILED("failed");

    private static final Map<String, WebhookEventStatus> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(WebhookEventStatus::value, Function.identity()));

    private final String value;

    WebhookEventStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static WebhookEventStatus fromValue(String value) {
        WebhookEventStatus status = value == null ? null : BY_VALUE.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown webhook event status: " + value);
        }
        return status;
    }
}
