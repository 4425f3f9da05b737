package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionsSyncResponse(
    List<PlaidTransaction> added,
    List<PlaidTransaction> modified,
    List<RemovedTransaction> removed,
    List<PlaidAccount> accounts,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("request_id") String requestId
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RemovedTransaction(
      @JsonProperty("transaction_id") String transactionId,
      @JsonProperty("account_id") String accountId
  ) {}
}
