package com.paycrypt.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.paycrypt.shared.enums.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only copy of a payment's public fields, taken by the payment domain at
 * the moment of a change. Webhook payloads are built from this and never from
 * the live payment row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentSnapshot {

    private Long id;
    private Long clientId;

    private BigDecimal amount;
    private String currency;
    private BigDecimal fiatAmount;
    private String fiatCurrency;
    private BigDecimal cryptoAmount;
    private String cryptoCurrency;

    private PaymentStatus status;
    private String paymentMethod;
    private String transactionId;
    private String description;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;
}
