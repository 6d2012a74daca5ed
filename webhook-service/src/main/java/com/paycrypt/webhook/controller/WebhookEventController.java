package com.paycrypt.webhook.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paycrypt.shared.dto.ApiResponse;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.exception.WebhookException;
import com.paycrypt.webhook.model.DispatchSummary;
import com.paycrypt.webhook.model.WebhookEventView;
import com.paycrypt.webhook.service.WebhookBatchRunner;
import com.paycrypt.webhook.service.WebhookEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/webhook-events")
@RequiredArgsConstructor
public class WebhookEventController {

    private final WebhookEventStore store;
    private final WebhookBatchRunner batchRunner;
    private final WebhookProperties properties;
    private final ObjectMapper objectMapper;

    @GetMapping("/{eventId}")
    public ResponseEntity<ApiResponse<WebhookEventView>> getEvent(@PathVariable("eventId") String eventId) {
        WebhookEventView view = store.findById(eventId)
                .map(event -> WebhookEventView.from(event, objectMapper))
                .orElseThrow(() -> WebhookException.eventNotFound(eventId));
        return ResponseEntity.ok(ApiResponse.ok(view));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<WebhookEventView>>> listForPayment(@RequestParam("paymentId") Long paymentId) {
        List<WebhookEventView> views = store.findByPayment(paymentId).stream()
                .map(event -> WebhookEventView.from(event, objectMapper))
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(views));
    }

    /**
     * Runs one dispatch pass now, outside the scheduler. Defaults come from webhook.dispatch.*.
     */
    @PostMapping("/dispatch")
    public ResponseEntity<ApiResponse<DispatchSummary>> dispatch(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "timeoutSeconds", required = false) Integer timeoutSeconds) {

        int effectiveLimit   = limit != null ? limit : properties.getDispatch().getBatchLimit();
        int effectiveTimeout = timeoutSeconds != null ? timeoutSeconds : properties.getDispatch().getTimeoutSeconds();
        if (effectiveLimit <= 0) {
            throw new WebhookException(WebhookException.INVALID_REQUEST, "limit must be positive");
        }
        if (!WebhookProperties.Dispatch.isValidTimeout(effectiveTimeout)) {
            throw new WebhookException(WebhookException.INVALID_REQUEST, "timeoutSeconds must be between 1 and "
                    + WebhookProperties.Dispatch.MAX_TIMEOUT_SECONDS);
        }

        DispatchSummary summary = batchRunner.runOnce(effectiveLimit, effectiveTimeout);
        return ResponseEntity.ok(ApiResponse.ok(summary));
    }

    @ExceptionHandler(WebhookException.class)
    public ResponseEntity<ApiResponse<Void>> handleWebhookException(WebhookException ex) {
        log.warn("Webhook API error [{}]: {}", ex.getCode(), ex.getMessage());
        HttpStatus status = WebhookException.EVENT_NOT_FOUND.equals(ex.getCode())
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }
}
