package com.paycrypt.webhook.exception;

import lombok.Getter;

/**
 * API-level failure carrying a stable error code for {@code ApiResponse.errorCode}.
 */
@Getter
public class WebhookException extends RuntimeException {

    public static final String EVENT_NOT_FOUND = "EVENT_NOT_FOUND";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    private final String code;

    public WebhookException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static WebhookException eventNotFound(String id) {
        return new WebhookException(EVENT_NOT_FOUND, "Webhook event not found: " + id);
    }
}
