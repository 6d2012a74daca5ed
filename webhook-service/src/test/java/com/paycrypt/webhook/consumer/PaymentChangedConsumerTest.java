package com.paycrypt.webhook.consumer;

import com.paycrypt.shared.enums.PaymentStatus;
import com.paycrypt.shared.enums.WebhookEventType;
import com.paycrypt.shared.events.PaymentChangedEvent;
import com.paycrypt.shared.events.PaymentSnapshot;
import com.paycrypt.webhook.service.PaymentWebhookEmitter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentChangedConsumerTest {

    @Mock private PaymentWebhookEmitter emitter;
    @Mock private Acknowledgment ack;

    @InjectMocks private PaymentChangedConsumer consumer;

    private final PaymentSnapshot payment = PaymentSnapshot.builder()
            .id(42L).clientId(7L).status(PaymentStatus.PENDING).build();

    @Test
    @DisplayName("Explicit event type (payment.created) is emitted as is")
    void consume_explicitType() {
        consumer.consume(PaymentChangedEvent.builder()
                .payment(payment).eventType(WebhookEventType.PAYMENT_CREATED).build(), ack);

        verify(emitter).emit(payment, WebhookEventType.PAYMENT_CREATED);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Status move is delegated to the transition mapping")
    void consume_statusChange() {
        consumer.consume(PaymentChangedEvent.builder()
                .payment(payment).previousStatus(PaymentStatus.APPROVED).build(), ack);

        verify(emitter).emitStatusChange(payment, PaymentStatus.APPROVED);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unchanged status emits nothing but still acknowledges")
    void consume_noChange() {
        consumer.consume(PaymentChangedEvent.builder()
                .payment(payment).previousStatus(PaymentStatus.PENDING).build(), ack);

        verifyNoInteractions(emitter);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Record without a payment is acknowledged and ignored")
    void consume_missingPayment() {
        consumer.consume(PaymentChangedEvent.builder().build(), ack);

        verify(emitter, never()).emit(any(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Emitter failure never blocks the partition")
    void consume_emitterThrows() {
        when(emitter.emit(payment, WebhookEventType.PAYMENT_CREATED)).thenThrow(new IllegalStateException("boom"));

        consumer.consume(PaymentChangedEvent.builder()
                .payment(payment).eventType(WebhookEventType.PAYMENT_CREATED).build(), ack);

        verify(ack).acknowledge();
    }
}
