package com.paycrypt.webhook.service;

/**
 * Status and body of a completed webhook POST, whatever the status code.
 */
public record WebhookHttpResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
