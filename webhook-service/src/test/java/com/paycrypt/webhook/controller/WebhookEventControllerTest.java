package com.paycrypt.webhook.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycrypt.shared.enums.WebhookEventType;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import com.paycrypt.webhook.model.DispatchSummary;
import com.paycrypt.webhook.service.WebhookBatchRunner;
import com.paycrypt.webhook.service.WebhookEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookEventControllerTest {

    @Mock private WebhookEventStore store;
    @Mock private WebhookBatchRunner batchRunner;

    private final WebhookProperties properties = new WebhookProperties();
    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WebhookEventController controller = new WebhookEventController(store, batchRunner, properties, objectMapper);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    private static WebhookEvent event() {
        return WebhookEvent.builder()
                .id("evt-1")
                .clientId(7L)
                .paymentId(42L)
                .eventType(WebhookEventType.PAYMENT_COMPLETED)
                .status(WebhookEventStatus.FAILED)
                .attempts(5)
                .lastError("HTTP 500: boom")
                .lastResponseCode(500)
                .payload("{\"event_type\":\"payment.completed\"}")
                .createdAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("GET by id returns the event view with wire values")
    void getEvent() throws Exception {
        when(store.findById("evt-1")).thenReturn(Optional.of(event()));

        mockMvc.perform(get("/api/v1/webhook-events/evt-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.event_type").value("payment.completed"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.max_attempts").value(5))
                .andExpect(jsonPath("$.data.last_response_code").value(500))
                .andExpect(jsonPath("$.data.payload.event_type").value("payment.completed"))
                .andExpect(jsonPath("$.data.created_at").value("2024-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Unknown id → 404 EVENT_NOT_FOUND")
    void getEvent_notFound() throws Exception {
        when(store.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/webhook-events/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("EVENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("List by payment")
    void listForPayment() throws Exception {
        when(store.findByPayment(42L)).thenReturn(List.of(event()));

        mockMvc.perform(get("/api/v1/webhook-events").param("paymentId", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("evt-1"))
                .andExpect(jsonPath("$.data[0].payment_id").value(42));
    }

    @Test
    @DisplayName("Manual dispatch uses configured defaults when no parameters are given")
    void dispatch_defaults() throws Exception {
        when(batchRunner.runOnce(100, 10)).thenReturn(new DispatchSummary(3, 2, 1, 0));

        mockMvc.perform(post("/api/v1/webhook-events/dispatch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processed").value(3))
                .andExpect(jsonPath("$.data.delivered").value(2))
                .andExpect(jsonPath("$.data.failed").value(1))
                .andExpect(jsonPath("$.data.skipped").value(0));

        verify(batchRunner).runOnce(100, 10);
    }

    @Test
    @DisplayName("Non-positive limit → 400 INVALID_REQUEST")
    void dispatch_invalidLimit() throws Exception {
        mockMvc.perform(post("/api/v1/webhook-events/dispatch").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));

        verifyNoInteractions(batchRunner);
    }

    @Test
    @DisplayName("Timeout above the allowed maximum → 400 INVALID_REQUEST")
    void dispatch_timeoutTooLarge() throws Exception {
        mockMvc.perform(post("/api/v1/webhook-events/dispatch").param("timeoutSeconds", "121"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));

        verifyNoInteractions(batchRunner);
    }
}
