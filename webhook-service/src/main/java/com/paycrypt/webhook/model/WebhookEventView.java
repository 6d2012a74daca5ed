package com.paycrypt.webhook.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycrypt.webhook.entity.WebhookEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outward representation of a webhook event. Secrets never appear here;
 * the payload is returned as parsed JSON.
 */
@Value
@Builder
public class WebhookEventView {

    String id;
    @JsonProperty("client_id")          Long clientId;
    @JsonProperty("payment_id")         Long paymentId;
    @JsonProperty("event_type")         String eventType;
    String status;
    int attempts;
    @JsonProperty("max_attempts")       int maxAttempts;
    @JsonProperty("next_attempt_at")    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant nextAttemptAt;
    JsonNode payload;
    @JsonProperty("last_error")         String lastError;
    @JsonProperty("last_response_code") Integer lastResponseCode;
    @JsonProperty("delivered_at")       @JsonFormat(shape = JsonFormat.Shape.STRING) Instant deliveredAt;
    @JsonProperty("created_at")         @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAt;
    @JsonProperty("updated_at")         @JsonFormat(shape = JsonFormat.Shape.STRING) Instant updatedAt;

    public static WebhookEventView from(WebhookEvent event, ObjectMapper objectMapper) {
        return WebhookEventView.builder()
                .id(event.getId())
                .clientId(event.getClientId())
                .paymentId(event.getPaymentId())
                .eventType(event.getEventType() != null ? event.getEventType().value() : null)
                .status(event.getStatus() != null ? event.getStatus().value() : null)
                .attempts(event.getAttempts())
                .maxAttempts(event.getMaxAttempts())
                .nextAttemptAt(event.getNextAttemptAt())
                .payload(parsePayload(event.getPayload(), objectMapper))
                .lastError(event.getLastError())
                .lastResponseCode(event.getLastResponseCode())
                .deliveredAt(event.getDeliveredAt())
                .createdAt(event.getCreatedAt())
                .updatedAt(event.getUpdatedAt())
                .build();
    }

    private static JsonNode parsePayload(String payload, ObjectMapper objectMapper) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (Exception e) {
            return objectMapper.getNodeFactory().textNode(payload);
        }
    }
}
