package com.paycrypt.webhook.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycrypt.shared.enums.PaymentStatus;
import com.paycrypt.shared.enums.WebhookEventType;
import com.paycrypt.shared.events.PaymentSnapshot;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.entity.ClientAccount;
import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import com.paycrypt.webhook.metrics.WebhookMetrics;
import com.paycrypt.webhook.repository.ClientAccountRepository;
import com.paycrypt.webhook.repository.WebhookEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookEventFactoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock private ClientAccountRepository clientAccountRepository;
    @Mock private WebhookEventRepository webhookEventRepository;
    @Mock private WebhookMetrics metrics;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebhookProperties properties = new WebhookProperties();
    private WebhookEventFactory factory;

    @BeforeEach
    void setUp() {
        factory = new WebhookEventFactory(clientAccountRepository, webhookEventRepository,
                properties, objectMapper, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PaymentSnapshot payment() {
        return PaymentSnapshot.builder()
                .id(42L)
                .clientId(7L)
                .amount(new BigDecimal("100.50"))
                .currency("USD")
                .cryptoAmount(new BigDecimal("0.0021"))
                .cryptoCurrency("BTC")
                .status(PaymentStatus.COMPLETED)
                .paymentMethod("crypto")
                .transactionId("tx-1")
                .createdAt(Instant.parse("2024-03-01T11:00:00Z"))
                .build();
    }

    private static ClientAccount client(boolean enabled, String url) {
        return ClientAccount.builder().id(7L).webhookEnabled(enabled).webhookUrl(url).webhookSecret("s3cret").build();
    }

    @Test
    @DisplayName("Configured client gets a pending, immediately-due event with a frozen payload")
    void createEvent_persistsPendingEvent() throws Exception {
        when(clientAccountRepository.findById(7L)).thenReturn(Optional.of(client(true, "https://merchant.example/hooks")));
        when(webhookEventRepository.save(any(WebhookEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        Optional<WebhookEvent> created = factory.createEvent(payment(), WebhookEventType.PAYMENT_COMPLETED);

        assertThat(created).isPresent();
        WebhookEvent event = created.get();
        assertThat(event.getId()).hasSize(36);
        assertThat(event.getStatus()).isEqualTo(WebhookEventStatus.PENDING);
        assertThat(event.getAttempts()).isZero();
        assertThat(event.getMaxAttempts()).isEqualTo(5);
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW);
        assertThat(event.getClientId()).isEqualTo(7L);
        assertThat(event.getPaymentId()).isEqualTo(42L);

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertThat(payload.path("event_type").asText()).isEqualTo("payment.completed");
        assertThat(payload.path("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        JsonNode body = payload.path("payment");
        assertThat(body.path("id").asLong()).isEqualTo(42L);
        assertThat(body.path("amount").isNumber()).isTrue();
        assertThat(body.path("amount").asDouble()).isEqualTo(100.5);
        assertThat(body.path("fiat_amount").isNull()).isTrue();
        assertThat(body.path("status").asText()).isEqualTo("completed");
        assertThat(body.path("created_at").asText()).isEqualTo("2024-03-01T11:00:00Z");
        assertThat(body.path("updated_at").isNull()).isTrue();

        verify(metrics).recordCreated();
    }

    @Test
    @DisplayName("Zero amount is sent as 0, missing amount as null")
    void buildPayload_zeroAmountIsNumber() {
        PaymentSnapshot free = payment();
        free.setAmount(BigDecimal.ZERO);
        free.setFiatAmount(null);

        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) factory
                .buildPayload(free, WebhookEventType.PAYMENT_COMPLETED, NOW).get("payment");

        assertThat(body.get("amount")).isEqualTo(0.0);
        assertThat(body).containsEntry("fiat_amount", null);
    }

    @Test
    @DisplayName("Configured max attempts is applied to new events")
    void createEvent_usesConfiguredMaxAttempts() {
        properties.setMaxAttempts(3);
        when(clientAccountRepository.findById(7L)).thenReturn(Optional.of(client(true, "https://merchant.example/hooks")));
        when(webhookEventRepository.save(any(WebhookEvent.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(factory.createEvent(payment(), WebhookEventType.PAYMENT_COMPLETED))
                .get().extracting(WebhookEvent::getMaxAttempts).isEqualTo(3);
    }

    @Test
    @DisplayName("Disabled webhooks → no event")
    void createEvent_disabledClient() {
        when(clientAccountRepository.findById(7L)).thenReturn(Optional.of(client(false, "https://merchant.example/hooks")));

        assertThat(factory.createEvent(payment(), WebhookEventType.PAYMENT_COMPLETED)).isEmpty();
        verify(webhookEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Blank URL → no event")
    void createEvent_blankUrl() {
        when(clientAccountRepository.findById(7L)).thenReturn(Optional.of(client(true, "  ")));

        assertThat(factory.createEvent(payment(), WebhookEventType.PAYMENT_COMPLETED)).isEmpty();
        verify(webhookEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unknown client or payment without client → no event")
    void createEvent_noClient() {
        when(clientAccountRepository.findById(7L)).thenReturn(Optional.empty());

        assertThat(factory.createEvent(payment(), WebhookEventType.PAYMENT_COMPLETED)).isEmpty();

        PaymentSnapshot orphan = payment();
        orphan.setClientId(null);
        assertThat(factory.createEvent(orphan, WebhookEventType.PAYMENT_COMPLETED)).isEmpty();
        assertThat(factory.createEvent(null, WebhookEventType.PAYMENT_COMPLETED)).isEmpty();
        verify(webhookEventRepository, never()).save(any());
    }
}
