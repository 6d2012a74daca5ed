package com.paycrypt.webhook.consumer;

import com.paycrypt.shared.events.PaymentChangedEvent;
import com.paycrypt.shared.util.KafkaTopics;
import com.paycrypt.webhook.service.PaymentWebhookEmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Queues webhooks for payment changes published by the payment domain.
 * Emission is best-effort, so every record is acknowledged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentChangedConsumer {

    private final PaymentWebhookEmitter emitter;

    @KafkaListener(
            topics = KafkaTopics.PAYMENT_CHANGED,
            groupId = "webhook-service",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(PaymentChangedEvent event, Acknowledgment ack) {
        try {
            if (event == null || event.getPayment() == null) {
                log.warn("Ignoring payment change without a payment snapshot");
                return;
            }
            if (event.getEventType() != null) {
                emitter.emit(event.getPayment(), event.getEventType());
            } else if (event.statusChanged()) {
                emitter.emitStatusChange(event.getPayment(), event.getPreviousStatus());
            } else {
                log.debug("paymentId={} status unchanged, no webhook", event.getPayment().getId());
            }
        } catch (Exception e) {
            log.error("Unrecoverable error handling payment change: {}", e.getMessage(), e);
        } finally {
            ack.acknowledge();
        }
    }
}
