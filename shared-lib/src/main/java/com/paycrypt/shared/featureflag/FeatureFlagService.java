package com.paycrypt.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flags backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Scope is a client id for per-client flags, with "global" as the fallback.
 * Set a flag via Redis CLI:
 *   HSET feature-flags:global webhook_dispatch_kill_switch true
 *   HSET feature-flags:client-42 webhook_emission_enabled false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    public static final String GLOBAL_SCOPE     = "global";

    public static final String WEBHOOK_DISPATCH_KILL_SWITCH = "webhook_dispatch_kill_switch";
    public static final String WEBHOOK_EMISSION_ENABLED     = "webhook_emission_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Per-scope value, then the global value, then defaultValue.
     */
    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        if (scopedVal != null) {
            return Boolean.parseBoolean(scopedVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(GLOBAL_SCOPE, flagName, defaultValue);
    }

    public static String clientScope(Long clientId) {
        return "client-" + clientId;
    }

    /**
     * Writes the global defaults if absent (called at startup).
     */
    public void initDefaults() {
        String key = FLAG_KEY_PREFIX + GLOBAL_SCOPE;
        redisTemplate.opsForHash().putIfAbsent(key, WEBHOOK_DISPATCH_KILL_SWITCH, "false");
        redisTemplate.opsForHash().putIfAbsent(key, WEBHOOK_EMISSION_ENABLED, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }
}
