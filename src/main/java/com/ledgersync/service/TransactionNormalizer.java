package com.ledgersync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ledgersync.provider.plaid.PlaidTransaction;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps upstream transactions onto the ledger's conventions. The aggregator reports expenses as
 * positive amounts, so every amount is negated. Only the amount can make a record unusable; every
 * other field falls back to a default.
 */
@Component
public class TransactionNormalizer {
  static final String DEFAULT_CURRENCY = "USD";
  static final String UNKNOWN_DESCRIPTION = "Unknown";

  public NormalizedTransaction normalize(PlaidTransaction transaction) {
    BigDecimal amount = normalizeAmount(transaction.transactionId(), transaction.amount());
    LocalDate transactionDate = parseDate(transaction.date());
    boolean pending = Boolean.TRUE.equals(transaction.pending());
    return new NormalizedTransaction(
        transaction.transactionId(),
        transaction.accountId(),
        amount,
        resolveCurrency(transaction),
        pending,
        blankToNull(transaction.pendingTransactionId()),
        resolveDescription(transaction),
        blankToNull(transaction.merchantName()),
        transaction.personalFinanceCategory() == null ? null : transaction.personalFinanceCategory().detailed(),
        resolveOccurredAt(transaction.datetime(), transactionDate),
        transactionDate,
        resolveIconUrl(transaction),
        blankToNull(transaction.paymentChannel()),
        blankToNull(transaction.website()));
  }

  BigDecimal normalizeAmount(String transactionId, JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new InvalidAmountException(transactionId, "Amount is missing");
    }
    BigDecimal upstream;
    if (node.isNumber()) {
      if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
        throw new InvalidAmountException(transactionId, "Amount is not finite");
      }
      upstream = node.decimalValue();
    } else if (node.isTextual()) {
      try {
        upstream = new BigDecimal(node.asText().trim());
      } catch (NumberFormatException ex) {
        throw new InvalidAmountException(transactionId, "Amount is not a number: " + node.asText());
      }
    } else {
      throw new InvalidAmountException(transactionId, "Amount has unexpected type " + node.getNodeType());
    }
    if (upstream.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return upstream.negate();
  }

  private static String resolveCurrency(PlaidTransaction transaction) {
    if (!isBlank(transaction.isoCurrencyCode())) {
      return transaction.isoCurrencyCode();
    }
    if (!isBlank(transaction.unofficialCurrencyCode())) {
      return transaction.unofficialCurrencyCode();
    }
    return DEFAULT_CURRENCY;
  }

  private static String resolveDescription(PlaidTransaction transaction) {
    if (!isBlank(transaction.name())) {
      return transaction.name();
    }
    if (!isBlank(transaction.originalDescription())) {
      return transaction.originalDescription();
    }
    return UNKNOWN_DESCRIPTION;
  }

  private static String resolveIconUrl(PlaidTransaction transaction) {
    if (!isBlank(transaction.logoUrl())) {
      return transaction.logoUrl();
    }
    List<PlaidTransaction.Counterparty> counterparties = transaction.counterparties();
    if (counterparties == null || counterparties.isEmpty() || counterparties.get(0) == null) {
      return null;
    }
    return blankToNull(counterparties.get(0).logoUrl());
  }

  private static Instant resolveOccurredAt(String datetime, LocalDate date) {
    Instant parsed = parseInstant(datetime);
    if (parsed != null) {
      return parsed;
    }
    return date == null ? null : date.atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  private static Instant parseInstant(String value) {
    if (isBlank(value)) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static LocalDate parseDate(String value) {
    if (isBlank(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static String blankToNull(String value) {
    return isBlank(value) ? null : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
