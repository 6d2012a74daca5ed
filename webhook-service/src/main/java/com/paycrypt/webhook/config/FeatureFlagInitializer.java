package com.paycrypt.webhook.config;

import com.paycrypt.shared.featureflag.FeatureFlagService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the global webhook flags on startup. Values already present in Redis
 * are left alone.
 *
 * To pause delivery without a restart:
 *   redis-cli HSET feature-flags:global webhook_dispatch_kill_switch true
 */
@Slf4j
@Configuration
public class FeatureFlagInitializer {

    @Bean
    public ApplicationRunner seedFeatureFlags(FeatureFlagService featureFlagService) {
        return args -> {
            featureFlagService.initDefaults();
            log.info("Webhook feature flags initialised for scope={}", FeatureFlagService.GLOBAL_SCOPE);
        };
    }
}
