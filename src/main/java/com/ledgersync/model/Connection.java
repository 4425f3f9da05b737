package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * One authorization grant to the aggregator. Sync bookkeeping columns ({@code cursor},
 * {@code syncStatus}, timestamps) are written through targeted repository updates only, never by
 * saving a loaded instance.
 */
@Entity
@Table(name = "connections")
@Getter
@Setter
public class Connection {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "external_id", unique = true)
  private String externalId;

  @Column(nullable = false)
  private String displayName;

  @Column
  private String institutionId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AggregatorEnvironment environment = AggregatorEnvironment.PRODUCTION;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ConnectionStatus status = ConnectionStatus.ACTIVE;

  @Column(columnDefinition = "TEXT")
  private String encryptedAccessToken;

  @Column(length = 2048)
  private String cursor;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_status")
  private SyncStatus syncStatus = SyncStatus.IDLE;

  @Column(nullable = false)
  private boolean autoSyncEnabled = true;

  @Column
  private Instant lastSyncedAt;

  @Column
  private Instant lastSyncStartedAt;

  @Column
  private Instant lastSyncCompletedAt;

  @Column(columnDefinition = "TEXT")
  private String lastSyncError;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column
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
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
