package com.paycrypt.webhook.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    /** Retry budget given to each new event. */
    @Min(1)
    private int maxAttempts = 5;

    /** Prefix of the outbound headers: {prefix}-Event, {prefix}-Signature, ... */
    @NotBlank
    private String headerPrefix = "X-Paycrypt";

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Dispatch {

        public static final int MAX_TIMEOUT_SECONDS = 120;

        private boolean schedulerEnabled = true;

        @Min(1)
        private long intervalMs = 60_000;

        @Min(1)
        private int batchLimit = 100;

        @Min(1)
        @Max(MAX_TIMEOUT_SECONDS)
        private int timeoutSeconds = 10;

        /** Added to the worst-case POST duration to size the claim lease. */
        @Min(0)
        private int leaseMarginSeconds = 30;

        /**
         * Connect and read timeouts are applied separately, so one POST can take
         * up to twice the timeout. The lease must outlive that.
         */
        public Duration leaseFor(Duration timeout) {
            return timeout.multipliedBy(2).plusSeconds(leaseMarginSeconds);
        }

        public static boolean isValidTimeout(int timeoutSeconds) {
            return timeoutSeconds >= 1 && timeoutSeconds <= MAX_TIMEOUT_SECONDS;
        }
    }
}
