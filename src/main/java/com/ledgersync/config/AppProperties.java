package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgersync.app")
public record AppProperties(String environment) {
  public boolean isDevelopment() {
    return "development".equalsIgnoreCase(environment);
  }
}
