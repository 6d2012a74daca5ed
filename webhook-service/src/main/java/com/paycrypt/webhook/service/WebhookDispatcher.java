package com.paycrypt.webhook.service;

import com.paycrypt.shared.signing.WebhookSigner;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.entity.ClientAccount;
import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.entity.WebhookEventStatus;
import com.paycrypt.webhook.metrics.WebhookMetrics;
import com.paycrypt.webhook.repository.ClientAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Delivers one webhook event: one signed POST, one recorded outcome.
 *
 * Flow:
 *   1. re-check eligibility, then claim the attempt (lease) in the store
 *   2. resolve the client's URL and secret
 *   3. sign timestamp + canonical body, POST with the timeout
 *   4. 2xx → markDelivered, anything else → markFailed with a classified error
 *
 * Every failure after a successful claim is recorded as a failed attempt, so
 * deliver never throws for transport, HTTP or signing problems. A guarded write
 * lost to a concurrent dispatcher turns the outcome into SKIPPED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDispatcher {

    static final String URL_NOT_CONFIGURED = "Client webhook URL not configured";
    private static final int MAX_DETAIL_LENGTH = 200;

    private final WebhookEventStore store;
    private final ClientAccountRepository clientAccountRepository;
    private final WebhookSigner signer;
    private final WebhookHttpClient httpClient;
    private final WebhookProperties properties;
    private final WebhookMetrics metrics;
    private final Clock clock;

    /**
     * @return true only when the client answered 2xx and the delivery was recorded
     */
    public boolean dispatch(WebhookEvent event, int timeoutSeconds) {
        return deliver(event, timeoutSeconds, UUID.randomUUID().toString()) == DispatchOutcome.DELIVERED;
    }

    public DispatchOutcome deliver(WebhookEvent event, int timeoutSeconds, String runId) {
        if (!event.isDeliverable(clock.instant())) {
            log.debug("runId={} eventId={} not deliverable (status={}, attempts={}/{}), skipping",
                    runId, event.getId(), event.getStatus(), event.getAttempts(), event.getMaxAttempts());
            return skipped();
        }

        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        if (!store.claim(event, properties.getDispatch().leaseFor(timeout))) {
            log.debug("runId={} eventId={} claimed by another dispatcher, skipping", runId, event.getId());
            return skipped();
        }

        try {
            return attempt(event, timeoutSeconds, timeout, runId);
        } catch (RuntimeException e) {
            log.error("runId={} eventId={} unexpected dispatch error: {}", runId, event.getId(), e.getMessage(), e);
            return recordFailure(event, "Unexpected error: " + truncate(e.getMessage()), null, runId);
        }
    }

    private DispatchOutcome attempt(WebhookEvent event, int timeoutSeconds, Duration timeout, String runId) {
        Optional<ClientAccount> client = clientAccountRepository.findById(event.getClientId());
        if (client.isEmpty() || !client.get().hasWebhookUrl()) {
            return recordFailure(event, URL_NOT_CONFIGURED, null, runId);
        }

        String timestamp = clock.instant().toString();
        String body;
        String signature = null;
        try {
            body = signer.canonicalJson(event.getPayload());
            if (client.get().hasWebhookSecret()) {
                signature = signer.sign(client.get().getWebhookSecret(), timestamp, event.getPayload());
            }
        } catch (RuntimeException e) {
            return recordFailure(event, "Failed to sign payload: " + e.getMessage(), null, runId);
        }

        HttpHeaders headers = buildHeaders(event, timestamp, signature);

        WebhookHttpResponse response;
        try {
            response = metrics.getDeliveryLatencyTimer().record(
                    () -> httpClient.post(client.get().getWebhookUrl(), headers, body, timeout));
        } catch (WebhookTransportException e) {
            return recordFailure(event, transportError(e, timeoutSeconds), null, runId);
        }

        if (response.isSuccess()) {
            return recordDelivered(event, response.statusCode(), runId);
        }
        String error = "HTTP " + response.statusCode() + ": " + truncate(response.body());
        return recordFailure(event, error, response.statusCode(), runId);
    }

    HttpHeaders buildHeaders(WebhookEvent event, String timestamp, String signature) {
        String prefix = properties.getHeaderPrefix();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(prefix + "-Event", event.getEventType().value());
        headers.set(prefix + "-Timestamp", timestamp);
        headers.set(prefix + "-Event-Id", event.getId());
        if (signature != null) {
            headers.set(prefix + "-Signature", signature);
        }
        return headers;
    }

    private DispatchOutcome recordDelivered(WebhookEvent event, int statusCode, String runId) {
        if (!store.markDelivered(event, statusCode)) {
            return skipped();
        }
        metrics.recordDelivered();
        log.info("runId={} eventId={} delivered type={} paymentId={} status={}",
                runId, event.getId(), event.getEventType(), event.getPaymentId(), statusCode);
        return DispatchOutcome.DELIVERED;
    }

    private DispatchOutcome recordFailure(WebhookEvent event, String error, Integer statusCode, String runId) {
        if (!store.markFailed(event, error, statusCode)) {
            return skipped();
        }
        metrics.recordFailed();
        if (event.getStatus() == WebhookEventStatus.FAILED) {
            metrics.recordExhausted();
            log.error("runId={} eventId={} exhausted after {} attempts, paymentId={} clientId={}: {}",
                    runId, event.getId(), event.getAttempts(), event.getPaymentId(), event.getClientId(), error);
        } else {
            log.warn("runId={} eventId={} attempt {}/{} failed, next at {}: {}",
                    runId, event.getId(), event.getAttempts(), event.getMaxAttempts(), event.getNextAttemptAt(), error);
        }
        return DispatchOutcome.FAILED;
    }

    private DispatchOutcome skipped() {
        metrics.recordSkipped();
        return DispatchOutcome.SKIPPED;
    }

    private static String transportError(WebhookTransportException e, int timeoutSeconds) {
        return switch (e.getKind()) {
            case TIMEOUT    -> "Request timeout after " + timeoutSeconds + "s";
            case CONNECTION -> "Connection error: " + truncate(e.getMessage());
            case REQUEST    -> "Request error: " + truncate(e.getMessage());
        };
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_DETAIL_LENGTH ? text : text.substring(0, MAX_DETAIL_LENGTH);
    }
}
