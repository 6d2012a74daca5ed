package com.paycrypt.webhook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycrypt.shared.enums.WebhookEventType;
import com.paycrypt.shared.events.PaymentSnapshot;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.entity.ClientAccount;
import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import com.paycrypt.webhook.metrics.WebhookMetrics;
import com.paycrypt.webhook.repository.ClientAccountRepository;
import com.paycrypt.webhook.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a payment change into a persisted, immediately-due webhook event.
 *
 * Returns empty, and writes nothing, when the payment has no client or the
 * client has not configured webhooks (disabled or blank URL). The payload is
 * frozen here: later changes to the payment never alter a queued event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventFactory {

    private final ClientAccountRepository clientAccountRepository;
    private final WebhookEventRepository webhookEventRepository;
    private final WebhookProperties properties;
    private final ObjectMapper objectMapper;
    private final WebhookMetrics metrics;
    private final Clock clock;

    @Transactional
    public Optional<WebhookEvent> createEvent(PaymentSnapshot payment, WebhookEventType eventType) {
        if (payment == null || payment.getId() == null || payment.getClientId() == null) {
            return Optional.empty();
        }
        if (eventType == null) {
            throw new IllegalArgumentException("eventType is required");
        }

        Optional<ClientAccount> client = clientAccountRepository.findById(payment.getClientId());
        if (client.isEmpty()) {
            log.debug("No client {} for paymentId={}, no webhook", payment.getClientId(), payment.getId());
            return Optional.empty();
        }
        if (!client.get().isWebhookEnabled() || !client.get().hasWebhookUrl()) {
            log.debug("Webhooks not configured for clientId={}, paymentId={}", payment.getClientId(), payment.getId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        WebhookEvent event = WebhookEvent.builder()
                .id(UUID.randomUUID().toString())
                .clientId(payment.getClientId())
                .paymentId(payment.getId())
                .eventType(eventType)
                .status(WebhookEventStatus.PENDING)
                .attempts(0)
                .maxAttempts(properties.getMaxAttempts())
                .nextAttemptAt(now)
                .payload(toJson(buildPayload(payment, eventType, now)))
                .createdAt(now)
                .updatedAt(now)
                .build();

        WebhookEvent saved = webhookEventRepository.save(event);
        metrics.recordCreated();
        log.info("Webhook event created eventId={} type={} paymentId={} clientId={}",
                saved.getId(), eventType, payment.getId(), payment.getClientId());
        return Optional.of(saved);
    }

    /**
     * Receiver-facing payload. Amounts are JSON numbers and are null only when the
     * payment has no value for them; a zero amount is sent as {@code 0}. Timestamps
     * are ISO-8601 UTC strings or null.
     */
    Map<String, Object> buildPayload(PaymentSnapshot payment, WebhookEventType eventType, Instant now) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", payment.getId());
        body.put("client_id", payment.getClientId());
        body.put("amount", number(payment.getAmount()));
        body.put("currency", payment.getCurrency());
        body.put("fiat_amount", number(payment.getFiatAmount()));
        body.put("fiat_currency", payment.getFiatCurrency());
        body.put("crypto_amount", number(payment.getCryptoAmount()));
        body.put("crypto_currency", payment.getCryptoCurrency());
        body.put("status", payment.getStatus() != null ? payment.getStatus().value() : null);
        body.put("payment_method", payment.getPaymentMethod());
        body.put("transaction_id", payment.getTransactionId());
        body.put("description", payment.getDescription());
        body.put("created_at", payment.getCreatedAt() != null ? payment.getCreatedAt().toString() : null);
        body.put("updated_at", payment.getUpdatedAt() != null ? payment.getUpdatedAt().toString() : null);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", eventType.value());
        payload.put("payment", body);
        payload.put("timestamp", now.toString());
        return payload;
    }

    private static Double number(BigDecimal value) {
        return value != null ? value.doubleValue() : null;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook payload", e);
        }
    }
}
