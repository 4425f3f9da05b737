package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaidAccount(
    @JsonProperty("account_id") String accountId,
    String name,
    @JsonProperty("official_name") String officialName,
    String mask,
    String type,
    String subtype,
    Balances balances
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Balances(
      BigDecimal current,
      BigDecimal available,
      BigDecimal limit,
      @JsonProperty("iso_currency_code") String isoCurrencyCode,
      @JsonProperty("unofficial_currency_code") String unofficialCurrencyCode
  ) {
    public String currency() {
      if (isoCurrencyCode != null && !isoCurrencyCode.isBlank()) {
        return isoCurrencyCode;
      }
      return unofficialCurrencyCode;
    }
  }
}
