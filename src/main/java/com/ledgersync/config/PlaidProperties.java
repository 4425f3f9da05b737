package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgersync.providers.plaid")
public record PlaidProperties(
    String baseUrl,
    String environment,
    String clientId,
    String secret,
    String apiVersion,
    Integer connectTimeoutMs,
    Integer readTimeoutMs,
    Integer retryMaxAttempts,
    Long retryInitialBackoffMs,
    Boolean debugLogResponses
) {}
