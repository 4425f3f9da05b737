package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgersync.crypto")
public record CryptoProperties(String secret) {}
