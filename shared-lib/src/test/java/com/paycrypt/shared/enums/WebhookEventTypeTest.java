package com.paycrypt.shared.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookEventTypeTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "pending,   payment.pending",
            "approved,  payment.approved",
            "completed, payment.completed",
            "failed,    payment.failed",
            "rejected,  payment.rejected",
            "cancelled, payment.cancelled"
    })
    @DisplayName("Each payment status maps to its webhook event type")
    void forPaymentStatus(String status, String expectedEvent) {
        assertThat(WebhookEventType.forPaymentStatus(PaymentStatus.fromValue(status)))
                .contains(WebhookEventType.fromValue(expectedEvent));
    }

    @Test
    @DisplayName("No event for a missing status")
    void forPaymentStatus_null() {
        assertThat(WebhookEventType.forPaymentStatus(null)).isEmpty();
    }

    @Test
    @DisplayName("Unknown wire values are rejected")
    void fromValue_unknown() {
        assertThatThrownBy(() -> WebhookEventType.fromValue("payment.refunded"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("payment.refunded");
        assertThatThrownBy(() -> PaymentStatus.fromValue("PENDING"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString is the wire value")
    void toString_isWireValue() {
        assertThat(WebhookEventType.PAYMENT_CREATED).hasToString("payment.created");
    }
}
