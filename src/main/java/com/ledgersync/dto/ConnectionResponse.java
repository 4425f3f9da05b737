package com.ledgersync.dto;

import com.ledgersync.model.AggregatorEnvironment;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.model.SyncStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ConnectionResponse {
  private UUID id;
  private String displayName;
  private String institutionId;
  private AggregatorEnvironment environment;
  private ConnectionStatus status;
  private boolean autoSyncEnabled;
  private boolean hasCursor;
  private SyncStatus syncStatus;
  private Instant lastSyncedAt;
  private Instant lastSyncStartedAt;
  private Instant lastSyncCompletedAt;
  private String lastSyncError;
  private String errorMessage;
  private Instant createdAt;
}
