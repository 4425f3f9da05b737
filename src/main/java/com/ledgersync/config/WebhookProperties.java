package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgersync.webhook")
public record WebhookProperties(long maxAgeSeconds, long keyCacheTtlSeconds, boolean skipVerification) {}
