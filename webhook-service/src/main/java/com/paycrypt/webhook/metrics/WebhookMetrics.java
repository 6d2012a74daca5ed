package com.paycrypt.webhook.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for webhook emission and delivery.
 *
 * Metrics at /actuator/prometheus:
 *   webhook_events_created_total
 *   webhook_delivery_total{outcome="delivered|failed|skipped"}
 *   webhook_events_exhausted_total  events that reached FAILED with the retry budget spent
 *   webhook_delivery_latency_seconds  p50/p95/p99 of the outbound POST
 */
@Component
public class WebhookMetrics {

    private final Counter createdCounter;
    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;
    private final Counter exhaustedCounter;
    private final Timer deliveryLatencyTimer;

    public WebhookMetrics(MeterRegistry registry) {
        this.createdCounter = Counter.builder("webhook.events.created")
                .description("Webhook events persisted for delivery")
                .register(registry);

        this.deliveredCounter = deliveryCounter(registry, "delivered");
        this.failedCounter    = deliveryCounter(registry, "failed");
        this.skippedCounter   = deliveryCounter(registry, "skipped");

        this.exhaustedCounter = Counter.builder("webhook.events.exhausted")
                .description("Webhook events that ran out of attempts")
                .register(registry);

        this.deliveryLatencyTimer = Timer.builder("webhook.delivery.latency")
                .description("Outbound webhook POST latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(10))
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(registry);
    }

    private static Counter deliveryCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("webhook.delivery")
                .description("Webhook delivery attempts by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    public void recordCreated()                 { createdCounter.increment(); }
    public void recordDelivered()               { deliveredCounter.increment(); }
    public void recordFailed()                  { failedCounter.increment(); }
    public void recordSkipped()                 { skippedCounter.increment(); }
    public void recordExhausted()               { exhaustedCounter.increment(); }
    public Timer getDeliveryLatencyTimer()      { return deliveryLatencyTimer; }
}
