package com.paycrypt.webhook.service;

import lombok.Getter;

/**
 * The POST did not produce an HTTP response.
 */
@Getter
public class WebhookTransportException extends RuntimeException {

    public enum Kind {
        /** Connect or read timeout. */
        TIMEOUT,
        /** Refused, unreachable or unresolvable host. */
        CONNECTION,
        /** Any other I/O or request construction problem. */
        REQUEST
    }

    private final Kind kind;

    public WebhookTransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
