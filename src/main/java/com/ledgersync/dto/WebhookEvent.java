package com.ledgersync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookEvent(
    @JsonProperty("webhook_type") String webhookType,
    @JsonProperty("webhook_code") String webhookCode,
    @JsonProperty("item_id") String itemId,
    @JsonProperty("removed_transactions") List<String> removedTransactions,
    WebhookError error,
    String environment
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WebhookError(
      @JsonProperty("error_type") String errorType,
      @JsonProperty("error_code") String errorCode,
      @JsonProperty("error_message") String errorMessage
  ) {}
}
