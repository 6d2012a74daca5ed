package com.paycrypt.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.paycrypt.shared.enums.PaymentStatus;
import com.paycrypt.shared.enums.WebhookEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published by the payment domain on {@code payment.changed} whenever a payment
 * is created or its status moves.
 *
 * eventType is set when the producer already knows which webhook to emit
 * (payment.created). Otherwise the consumer derives it from the status move.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentChangedEvent {

    private PaymentSnapshot payment;
    private PaymentStatus previousStatus;
    private WebhookEventType eventType;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;

    public boolean statusChanged() {
        return payment != null && payment.getStatus() != null && payment.getStatus() != previousStatus;
    }
}
