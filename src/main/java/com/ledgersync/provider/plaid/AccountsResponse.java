package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountsResponse(
    List<PlaidAccount> accounts,
    @JsonProperty("request_id") String requestId
) {}
