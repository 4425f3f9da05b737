package com.ledgersync.service;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.model.SyncStatus;
import com.ledgersync.repository.ConnectionRepository;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final ConnectionRepository connectionRepository;
  private final SyncService syncService;
  private final SyncProperties properties;

  public SyncScheduler(ConnectionRepository connectionRepository,
                       SyncService syncService,
                       SyncProperties properties) {
    this.connectionRepository = connectionRepository;
    this.syncService = syncService;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${ledgersync.sync.poll-ms:60000}")
  public void run() {
    if (!properties.enabled()) {
      return;
    }
    Instant now = Instant.now();
    int due = 0;
    for (Connection connection : connectionRepository.findByAutoSyncEnabledTrueAndStatus(ConnectionStatus.ACTIVE)) {
      if (!shouldSync(connection, now, properties.intervalMs())) {
        continue;
      }
      SyncOutcome outcome = syncService.syncConnection(connection, false);
      if (!outcome.success()) {
        log.info("Scheduled sync of connection {} ended with {}", connection.getId(), outcome.code());
      }
      due++;
    }
    if (due > 0) {
      log.debug("Scheduled sync ran for {} connections", due);
    }
  }

  static boolean shouldSync(Connection connection, Instant now, long intervalMs) {
    if (connection.getSyncStatus() == SyncStatus.SYNCING) {
      return false;
    }
    if (intervalMs <= 0) {
      return true;
    }
    Instant lastSync = connection.getLastSyncCompletedAt();
    if (lastSync == null) {
      lastSync = connection.getLastSyncedAt();
    }
    if (lastSync == null) {
      return true;
    }
    return Duration.between(lastSync, now).toMillis() >= intervalMs;
  }
}
