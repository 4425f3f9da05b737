package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.config.PlaidProperties;
import io.github.resilience4j.retry.Retry;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin client over the aggregator's JSON-over-POST API. Rate-limited calls are retried with
 * exponential backoff by {@code plaidRetry}; every other failure surfaces as a
 * {@link PlaidApiException} on the first attempt.
 */
@Component
public class PlaidClient {
  static final String RATE_LIMIT_ERROR_TYPE = "RATE_LIMIT_EXCEEDED";
  private static final Logger log = LoggerFactory.getLogger(PlaidClient.class);
  private static final int MAX_LOGGED_BODY = 2000;

  private final RestClient restClient;
  private final Retry retry;
  private final ObjectMapper objectMapper;
  private final PlaidProperties properties;

  public PlaidClient(@Qualifier("plaidRestClient") RestClient restClient,
                     @Qualifier("plaidRetry") Retry retry,
                     ObjectMapper objectMapper,
                     PlaidProperties properties) {
    this.restClient = restClient;
    this.retry = retry;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * One page of cursor-based deltas. A {@code null} cursor is sent as the empty string, which the
   * aggregator reads as "from the beginning".
   */
  public TransactionsSyncResponse syncTransactions(String accessToken, String cursor, int count) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("access_token", accessToken);
    body.put("cursor", cursor == null ? "" : cursor);
    body.put("count", count);
    return post("/transactions/sync", body, TransactionsSyncResponse.class);
  }

  public TransactionsGetResponse getTransactions(String accessToken, LocalDate startDate, LocalDate endDate, int count) {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("count", count);
    options.put("offset", 0);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("access_token", accessToken);
    body.put("start_date", startDate.toString());
    body.put("end_date", endDate.toString());
    body.put("options", options);
    return post("/transactions/get", body, TransactionsGetResponse.class);
  }

  public AccountsResponse getAccounts(String accessToken) {
    return post("/accounts/get", Map.of("access_token", accessToken), AccountsResponse.class);
  }

  public AccountsResponse getBalances(String accessToken) {
    return post("/accounts/balance/get", Map.of("access_token", accessToken), AccountsResponse.class);
  }

  public VerificationKeyResponse.JsonWebKey getWebhookVerificationKey(String keyId) {
    VerificationKeyResponse response = post("/webhook_verification_key/get",
        Map.of("key_id", keyId), VerificationKeyResponse.class);
    if (response.key() == null) {
      throw new PlaidApiException("/webhook_verification_key/get", 200, "API_ERROR", "MISSING_KEY",
          "Response carried no key");
    }
    return response.key();
  }

  private <T> T post(String path, Object body, Class<T> responseType) {
    return retry.executeSupplier(() -> execute(path, body, responseType));
  }

  private <T> T execute(String path, Object body, Class<T> responseType) {
    T response;
    try {
      response = restClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .body(responseType);
    } catch (RestClientResponseException ex) {
      throw translate(path, ex);
    } catch (ResourceAccessException ex) {
      throw new PlaidApiException(path, 0, "API_ERROR", "NETWORK_ERROR", ex.getMessage(), ex);
    }
    if (response == null) {
      throw new PlaidApiException(path, 200, "API_ERROR", "EMPTY_RESPONSE", "Empty response body");
    }
    if (Boolean.TRUE.equals(properties.debugLogResponses())) {
      log.info("Plaid {} response: {}", path, truncate(String.valueOf(response)));
    }
    return response;
  }

  private PlaidApiException translate(String path, RestClientResponseException ex) {
    int status = ex.getStatusCode().value();
    String errorType = null;
    String errorCode = null;
    String message = ex.getStatusText();
    String raw = ex.getResponseBodyAsString();
    if (raw != null && !raw.isBlank()) {
      try {
        JsonNode error = objectMapper.readTree(raw);
        errorType = text(error, "error_type");
        errorCode = text(error, "error_code");
        String errorMessage = text(error, "error_message");
        if (errorMessage != null) {
          message = errorMessage;
        }
      } catch (Exception parseError) {
        log.debug("Plaid {} returned a non-JSON error body: {}", path, truncate(raw));
      }
    }
    if (status == 429 || RATE_LIMIT_ERROR_TYPE.equals(errorType)) {
      return new PlaidRateLimitedException(path, status, errorCode, message);
    }
    log.warn("Plaid {} failed with {} {} {}", path, status, errorType, errorCode);
    return new PlaidApiException(path, status, errorType, errorCode, message, ex);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static String truncate(String value) {
    if (value == null || value.length() <= MAX_LOGGED_BODY) {
      return value;
    }
    return value.substring(0, MAX_LOGGED_BODY) + "...";
  }
}
