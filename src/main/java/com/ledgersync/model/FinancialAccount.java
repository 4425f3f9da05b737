package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "financial_accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_account_connection_external",
        columnNames = {"connection_id", "external_id"}))
@Getter
@Setter
public class FinancialAccount {
  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "connection_id")
  private Connection connection;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "external_id", nullable = false)
  private String externalId;

  @Column(nullable = false)
  private String name;

  @Column
  private String officialName;

  @Column(length = 16)
  private String mask;

  @Column(length = 64)
  private String type;

  @Column(length = 64)
  private String subtype;

  @Column
  private String institutionId;

  @Column(precision = 19, scale = 4)
  private BigDecimal currentBalance;

  @Column(precision = 19, scale = 4)
  private BigDecimal availableBalance;

  @Column(precision = 19, scale = 4)
  private BigDecimal creditLimit;

  @Column(length = 16)
  private String currency;

  @Column
  private Instant balanceUpdatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
  }
}
