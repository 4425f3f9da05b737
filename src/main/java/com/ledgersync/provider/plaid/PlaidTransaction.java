package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.Builder;

/**
 * Transaction as returned by {@code /transactions/sync} and {@code /transactions/get}. Optional
 * fields stay raw here; defaults are resolved by the normalizer. {@code amount} is kept as a node
 * so an unparseable value skips one record instead of failing the whole response.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaidTransaction(
    @JsonProperty("transaction_id") String transactionId,
    @JsonProperty("account_id") String accountId,
    JsonNode amount,
    @JsonProperty("iso_currency_code") String isoCurrencyCode,
    @JsonProperty("unofficial_currency_code") String unofficialCurrencyCode,
    String date,
    String datetime,
    @JsonProperty("authorized_date") String authorizedDate,
    String name,
    @JsonProperty("merchant_name") String merchantName,
    @JsonProperty("original_description") String originalDescription,
    Boolean pending,
    @JsonProperty("pending_transaction_id") String pendingTransactionId,
    @JsonProperty("logo_url") String logoUrl,
    String website,
    @JsonProperty("payment_channel") String paymentChannel,
    @JsonProperty("personal_finance_category") PersonalFinanceCategory personalFinanceCategory,
    List<Counterparty> counterparties
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Counterparty(
      String name,
      String type,
      @JsonProperty("logo_url") String logoUrl,
      String website
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PersonalFinanceCategory(
      String primary,
      String detailed,
      @JsonProperty("confidence_level") String confidenceLevel
  ) {}
}
