package com.paycrypt.webhook.config;

import com.paycrypt.shared.signing.WebhookSigner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebhookSigner webhookSigner() {
        return new WebhookSigner();
    }
}
