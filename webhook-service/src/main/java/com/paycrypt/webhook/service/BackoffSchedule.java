package com.paycrypt.webhook.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fixed retry delays, indexed by the attempts count before the failed attempt is
 * recorded. Five attempts span roughly five hours.
 *
 *   attempts=0 → 1 min
 *   attempts=1 → 5 min
 *   attempts=2 → 15 min
 *   attempts=3 → 60 min
 *   attempts≥4 → 240 min
 */
public final class BackoffSchedule {

    private static final List<Duration> DELAYS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(60),
            Duration.ofMinutes(240)
    );

    private BackoffSchedule() {}

    public static Duration delayFor(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, was " + attempts);
        }
        return DELAYS.get(Math.min(attempts, DELAYS.size() - 1));
    }

    public static Instant nextAttemptAt(int attempts, Instant now) {
        return now.plus(delayFor(attempts));
    }
}
