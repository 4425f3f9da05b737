package com.ledgersync.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Canonical form of one upstream transaction, signed so that positive means money in.
 */
public record NormalizedTransaction(
    String upstreamTransactionId,
    String upstreamAccountId,
    BigDecimal amount,
    String currency,
    boolean pending,
    String pendingUpstreamId,
    String description,
    String merchantName,
    String categoryKey,
    Instant occurredAt,
    LocalDate transactionDate,
    String iconUrl,
    String paymentChannel,
    String website
) {
  /** True when this record replaces an earlier pending record stored under another id. */
  public boolean supersedesPending() {
    return pendingUpstreamId != null && !pendingUpstreamId.equals(upstreamTransactionId);
  }
}
