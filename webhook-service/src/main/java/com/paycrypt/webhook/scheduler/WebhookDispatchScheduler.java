package com.paycrypt.webhook.scheduler;

import com.paycrypt.shared.featureflag.FeatureFlagService;
import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.model.DispatchSummary;
import com.paycrypt.webhook.service.WebhookBatchRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic dispatch of due webhook events.
 *
 * Fixed delay, so a slow run is never overlapped by the next tick of the same
 * instance. Overlap across instances is handled by the claim in the store.
 * Kill switch: HSET feature-flags:global webhook_dispatch_kill_switch true
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "webhook.dispatch", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class WebhookDispatchScheduler {

    private final WebhookBatchRunner batchRunner;
    private final FeatureFlagService featureFlagService;
    private final WebhookProperties properties;

    @Scheduled(fixedDelayString = "${webhook.dispatch.interval-ms:60000}")
    public void dispatchDueEvents() {
        try {
            if (featureFlagService.isEnabled(FeatureFlagService.WEBHOOK_DISPATCH_KILL_SWITCH, false)) {
                log.warn("Webhook dispatch kill switch is on, skipping tick");
                return;
            }
            WebhookProperties.Dispatch dispatch = properties.getDispatch();
            DispatchSummary summary = batchRunner.runOnce(dispatch.getBatchLimit(), dispatch.getTimeoutSeconds());
            if (summary.failed() > 0) {
                log.warn("Webhook tick finished with {} failed attempt(s) of {}", summary.failed(), summary.processed());
            }
        } catch (Exception e) {
            log.error("Webhook dispatch run failed, retrying next tick: {}", e.getMessage(), e);
        }
    }
}
