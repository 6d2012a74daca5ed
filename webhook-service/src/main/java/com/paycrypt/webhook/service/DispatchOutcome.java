package com.paycrypt.webhook.service;

public enum DispatchOutcome {
    /** 2xx received and recorded. */
    DELIVERED,
    /** Attempt recorded as failed; the event is rescheduled or exhausted. */
    FAILED,
    /** Nothing recorded: not deliverable, or another dispatcher owns this attempt. */
    SKIPPED
}
