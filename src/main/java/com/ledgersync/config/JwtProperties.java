package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgersync.jwt")
public record JwtProperties(String secret, String issuer, long ttlMinutes) {}
