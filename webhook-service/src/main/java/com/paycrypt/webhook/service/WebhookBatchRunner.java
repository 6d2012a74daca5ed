package com.paycrypt.webhook.service;

import com.paycrypt.webhook.config.WebhookProperties;
import com.paycrypt.webhook.entity.WebhookEvent;
import com.paycrypt.webhook.model.DispatchSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * One dispatch pass over the due events, processed sequentially.
 *
 * A failure to fetch the due events propagates to the caller; a failure while
 * delivering a single event is logged, counted as failed and never stops the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookBatchRunner {

    private final WebhookEventStore store;
    private final WebhookDispatcher dispatcher;

    public DispatchSummary runOnce(int limit, int timeoutSeconds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (!WebhookProperties.Dispatch.isValidTimeout(timeoutSeconds)) {
            throw new IllegalArgumentException("timeoutSeconds must be between 1 and "
                    + WebhookProperties.Dispatch.MAX_TIMEOUT_SECONDS);
        }

        String runId = newRunId();
        List<WebhookEvent> due = store.dueEvents(limit);
        if (due.isEmpty()) {
            log.debug("runId={} no webhook events due", runId);
            return DispatchSummary.empty();
        }

        log.info("runId={} dispatching {} webhook event(s) limit={} timeout={}s", runId, due.size(), limit, timeoutSeconds);

        int delivered = 0;
        int failed = 0;
        int skipped = 0;
        for (WebhookEvent event : due) {
            DispatchOutcome outcome;
            try {
                outcome = dispatcher.deliver(event, timeoutSeconds, runId);
            } catch (Exception e) {
                log.error("runId={} eventId={} dispatch aborted: {}", runId, event.getId(), e.getMessage(), e);
                outcome = DispatchOutcome.FAILED;
            }
            switch (outcome) {
                case DELIVERED -> delivered++;
                case FAILED    -> failed++;
                case SKIPPED   -> skipped++;
            }
        }

        DispatchSummary summary = new DispatchSummary(due.size(), delivered, failed, skipped);
        log.info("runId={} webhook run finished processed={} delivered={} failed={} skipped={}",
                runId, summary.processed(), summary.delivered(), summary.failed(), summary.skipped());
        return summary;
    }

    static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
