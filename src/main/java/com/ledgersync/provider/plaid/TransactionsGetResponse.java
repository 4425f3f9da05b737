package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionsGetResponse(
    List<PlaidTransaction> transactions,
    List<PlaidAccount> accounts,
    @JsonProperty("total_transactions") Integer totalTransactions,
    @JsonProperty("request_id") String requestId
) {}
