package com.paycrypt.webhook.model;

/**
 * Tally of one dispatch run. processed = delivered + failed + skipped.
 */
public record DispatchSummary(int processed, int delivered, int failed, int skipped) {

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0, 0);
    }
}
