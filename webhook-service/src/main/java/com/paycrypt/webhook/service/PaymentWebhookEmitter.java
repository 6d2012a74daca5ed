package com.paycrypt.webhook.service;

import com.paycrypt.shared.enums.PaymentStatus;
import com.paycrypt.shared.enums.WebhookEventType;
import com.paycrypt.shared.events.PaymentSnapshot;
import com.paycrypt.shared.featureflag.FeatureFlagService;
import com.paycrypt.webhook.entity.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Best-effort webhook emission for payment changes.
 *
 * Callers are payment updates that must not fail because a webhook could not be
 * queued: every error is logged with the payment id and reported as empty.
 * Emission can be muted per client with the {@code webhook_emission_enabled} flag;
 * when the flag cannot be read, emission proceeds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentWebhookEmitter {

    private final WebhookEventFactory eventFactory;
    private final FeatureFlagService featureFlagService;

    public Optional<WebhookEvent> emit(PaymentSnapshot payment, WebhookEventType eventType) {
        if (payment == null || eventType == null) {
            return Optional.empty();
        }
        try {
            if (!emissionEnabled(payment.getClientId())) {
                log.info("Webhook emission muted for clientId={}, paymentId={} type={}",
                        payment.getClientId(), payment.getId(), eventType);
                return Optional.empty();
            }
            return eventFactory.createEvent(payment, eventType);
        } catch (Exception e) {
            log.error("Failed to create webhook event for paymentId={} type={}: {}",
                    payment.getId(), eventType, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Emits the event matching the payment's new status. Nothing is emitted when
     * the status did not change.
     */
    public Optional<WebhookEvent> emitStatusChange(PaymentSnapshot payment, PaymentStatus previousStatus) {
        if (payment == null || payment.getStatus() == null
                || Objects.equals(payment.getStatus(), previousStatus)) {
            return Optional.empty();
        }
        return WebhookEventType.forPaymentStatus(payment.getStatus())
                .flatMap(eventType -> emit(payment, eventType));
    }

    /**
     * Fails open: an unreadable flag store must not drop events for configured clients.
     */
    private boolean emissionEnabled(Long clientId) {
        try {
            if (clientId == null) {
                return featureFlagService.isEnabled(FeatureFlagService.WEBHOOK_EMISSION_ENABLED, true);
            }
            return featureFlagService.isEnabled(FeatureFlagService.clientScope(clientId),
                    FeatureFlagService.WEBHOOK_EMISSION_ENABLED, true);
        } catch (RuntimeException e) {
            log.warn("Could not read {} for clientId={}, emitting anyway: {}",
                    FeatureFlagService.WEBHOOK_EMISSION_ENABLED, clientId, e.getMessage());
            return true;
        }
    }
}
