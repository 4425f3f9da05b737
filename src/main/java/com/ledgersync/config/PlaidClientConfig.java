package com.ledgersync.config;

import com.ledgersync.provider.plaid.PlaidRateLimitedException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PlaidClientConfig {
  private static final Logger log = LoggerFactory.getLogger(PlaidClientConfig.class);
  private static final int DEFAULT_CONNECT_TIMEOUT_MS = 3000;
  private static final int DEFAULT_READ_TIMEOUT_MS = 5000;
  private static final int DEFAULT_RETRY_ATTEMPTS = 3;
  private static final long DEFAULT_RETRY_BACKOFF_MS = 500L;

  @Bean
  public RestClient plaidRestClient(PlaidProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(orDefault(properties.connectTimeoutMs(), DEFAULT_CONNECT_TIMEOUT_MS));
    requestFactory.setReadTimeout(orDefault(properties.readTimeoutMs(), DEFAULT_READ_TIMEOUT_MS));

    RestClient.Builder builder = RestClient.builder()
        .baseUrl(resolveBaseUrl(properties))
        .requestFactory(requestFactory)
        .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
    if (properties.clientId() != null && !properties.clientId().isBlank()) {
      builder.defaultHeader("PLAID-CLIENT-ID", properties.clientId());
    }
    if (properties.secret() != null && !properties.secret().isBlank()) {
      builder.defaultHeader("PLAID-SECRET", properties.secret());
    }
    if (properties.apiVersion() != null && !properties.apiVersion().isBlank()) {
      builder.defaultHeader("Plaid-Version", properties.apiVersion());
    }
    return builder.build();
  }

  @Bean
  public Retry plaidRetry(PlaidProperties properties) {
    int attempts = Math.max(1, orDefault(properties.retryMaxAttempts(), DEFAULT_RETRY_ATTEMPTS));
    long backoff = properties.retryInitialBackoffMs() == null
        ? DEFAULT_RETRY_BACKOFF_MS
        : Math.max(1L, properties.retryInitialBackoffMs());
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(attempts)
        .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
        .retryExceptions(PlaidRateLimitedException.class)
        .build();
    Retry retry = Retry.of("plaid", config);
    retry.getEventPublisher().onRetry(event -> log.warn("Plaid rate limited, retry {} of {} in {}",
        event.getNumberOfRetryAttempts(), attempts - 1, event.getWaitInterval()));
    return retry;
  }

  static String resolveBaseUrl(PlaidProperties properties) {
    if (properties.baseUrl() != null && !properties.baseUrl().isBlank()) {
      return properties.baseUrl();
    }
    String env = properties.environment() == null ? "sandbox" : properties.environment().toLowerCase();
    return switch (env) {
      case "production" -> "https://production.plaid.com";
      case "development" -> "https://development.plaid.com";
      default -> "https://sandbox.plaid.com";
    };
  }

  private static int orDefault(Integer value, int fallback) {
    return value == null || value <= 0 ? fallback : value;
  }
}
