package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * Ledger row. Amounts are signed with positive meaning money in.
 */
@Entity
@Table(name = "account_transactions",
    uniqueConstraints = @UniqueConstraint(name = "uk_transaction_account_upstream",
        columnNames = {"account_id", "upstream_transaction_id"}))
@Getter
@Setter
public class AccountTransaction {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "account_id")
  private FinancialAccount account;

  @Column(name = "upstream_transaction_id", nullable = false, length = 128)
  private String upstreamTransactionId;

  @Column(name = "pending_upstream_id", length = 128)
  private String pendingUpstreamId;

  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(nullable = false, length = 16)
  private String currency;

  @Column(nullable = false)
  private boolean pending;

  @Column(nullable = false)
  private String description;

  @Column
  private String merchantName;

  @Column(length = 128)
  private String categoryKey;

  @Column
  private Instant occurredAt;

  @Column
  private LocalDate transactionDate;

  @Column(length = 1024)
  private String iconUrl;

  @Column(length = 32)
  private String paymentChannel;

  @Column
  private String website;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    description = truncate(description, DEFAULT_VARCHAR_LIMIT);
    merchantName = truncate(merchantName, DEFAULT_VARCHAR_LIMIT);
    website = truncate(website, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
