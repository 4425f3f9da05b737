package com.ledgersync.service;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.model.FetchMode;
import com.ledgersync.provider.FetchRequest;
import com.ledgersync.provider.FetchStrategyRegistry;
import com.ledgersync.provider.FetchSummary;
import com.ledgersync.provider.SyncLimitExceededException;
import com.ledgersync.provider.TransactionFetchStrategy;
import com.ledgersync.provider.plaid.PlaidApiException;
import com.ledgersync.repository.ConnectionRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Runs a connection through {@code IDLE -> SYNCING -> IDLE | ERROR}. The {@code SYNCING} flag is
 * claimed with a conditional update in the database, so concurrent triggers (API, webhook,
 * scheduler) see at most one winner. The stored cursor changes only when a run completes. Every
 * failure comes back as a {@link SyncOutcome}.
 */
@Service
public class SyncService {
  private static final Logger log = LoggerFactory.getLogger(SyncService.class);
  private static final long DEFAULT_STALE_LOCK_MINUTES = 30;
  private static final String ITEM_ERROR_TYPE = "ITEM_ERROR";

  private final ConnectionRepository connectionRepository;
  private final FetchStrategyRegistry strategyRegistry;
  private final ReconciliationService reconciliationService;
  private final BalanceRefreshService balanceRefreshService;
  private final CredentialVault credentialVault;
  private final SyncProperties properties;

  public SyncService(ConnectionRepository connectionRepository,
                     FetchStrategyRegistry strategyRegistry,
                     ReconciliationService reconciliationService,
                     BalanceRefreshService balanceRefreshService,
                     CredentialVault credentialVault,
                     SyncProperties properties) {
    this.connectionRepository = connectionRepository;
    this.strategyRegistry = strategyRegistry;
    this.reconciliationService = reconciliationService;
    this.balanceRefreshService = balanceRefreshService;
    this.credentialVault = credentialVault;
    this.properties = properties;
  }

  public SyncOutcome sync(UUID connectionId, UUID userId, boolean force) {
    return connectionRepository.findByIdAndUserId(connectionId, userId)
        .map(connection -> syncConnection(connection, force))
        .orElseGet(() -> SyncOutcome.failure(connectionId, SyncErrorCode.NOT_FOUND, "Connection not found"));
  }

  public List<SyncOutcome> syncAllForUser(UUID userId) {
    return connectionRepository.findByUserId(userId).stream()
        .filter(connection -> connection.getStatus() != null && connection.getStatus().isSyncable())
        .map(connection -> syncConnection(connection, false))
        .toList();
  }

  /** Forgets the stored cursor and rebuilds the connection's history with a forced run. */
  public SyncOutcome resetCursor(UUID connectionId, UUID userId) {
    Connection connection = connectionRepository.findByIdAndUserId(connectionId, userId).orElse(null);
    if (connection == null) {
      return SyncOutcome.failure(connectionId, SyncErrorCode.NOT_FOUND, "Connection not found");
    }
    connectionRepository.resetCursor(connectionId, Instant.now());
    log.info("Cursor reset for connection {}", connectionId);
    return connectionRepository.findById(connectionId)
        .map(reloaded -> syncConnection(reloaded, true))
        .orElseGet(() -> SyncOutcome.failure(connectionId, SyncErrorCode.NOT_FOUND, "Connection not found"));
  }

  @Async
  public void syncInBackground(UUID connectionId) {
    Connection connection = connectionRepository.findById(connectionId).orElse(null);
    if (connection == null) {
      log.warn("Background sync skipped: connection {} no longer exists", connectionId);
      return;
    }
    SyncOutcome outcome = syncConnection(connection, false);
    if (!outcome.success()) {
      log.info("Background sync of connection {} ended with {}: {}", connectionId, outcome.code(), outcome.error());
    }
  }

  public SyncOutcome syncConnection(Connection connection, boolean force) {
    UUID connectionId = connection.getId();
    if (connection.getStatus() == null || !connection.getStatus().isSyncable()) {
      return SyncOutcome.failure(connectionId, SyncErrorCode.CONNECTION_INACTIVE,
          "Connection is " + connection.getStatus());
    }
    if (connection.getEncryptedAccessToken() == null || connection.getEncryptedAccessToken().isBlank()) {
      return SyncOutcome.failure(connectionId, SyncErrorCode.CONNECTION_INACTIVE, "Connection has no access token");
    }
    if (!claim(connectionId, force)) {
      log.info("Sync of connection {} refused: already syncing", connectionId);
      return SyncOutcome.failure(connectionId, SyncErrorCode.ALREADY_SYNCING, "Sync already in progress");
    }
    log.info("Sync of connection {} started{}", connectionId, force ? " (forced)" : "");
    try {
      return run(connection);
    } catch (SyncLimitExceededException ex) {
      return fail(connectionId, SyncErrorCode.SYNC_LIMIT_EXCEEDED, ex.getMessage(), ex);
    } catch (PlaidApiException ex) {
      if (ITEM_ERROR_TYPE.equals(ex.getErrorType())) {
        markItemError(connectionId, ex);
      }
      return fail(connectionId, SyncErrorCode.UPSTREAM_ERROR, ex.getMessage(), ex);
    } catch (DataAccessException | TransactionException ex) {
      return fail(connectionId, SyncErrorCode.STORAGE_ERROR, "Failed to store synced transactions", ex);
    } catch (RuntimeException ex) {
      return fail(connectionId, SyncErrorCode.INTERNAL_ERROR, "Unexpected sync failure", ex);
    }
  }

  private SyncOutcome run(Connection connection) {
    UUID connectionId = connection.getId();
    String accessToken = credentialVault.open(connectionId, connection.getEncryptedAccessToken());
    TransactionFetchStrategy strategy = strategyRegistry.forEnvironment(connection.getEnvironment());
    boolean incremental = strategy.mode() == FetchMode.INCREMENTAL;
    SyncTotals totals = new SyncTotals();

    FetchRequest request = new FetchRequest(accessToken, incremental ? connection.getCursor() : null);
    FetchSummary summary = strategy.fetch(request,
        batch -> totals.add(reconciliationService.reconcile(connection, batch)));

    // the cursor moves only once every round is stored; a failed run replays from the old one
    if (incremental && summary.cursor() != null) {
      connectionRepository.completeSyncWithCursor(connectionId, summary.cursor(), Instant.now());
    } else {
      connectionRepository.completeSync(connectionId, Instant.now());
    }
    log.info("Sync of connection {} completed in {} mode: rounds={} upserted={} promoted={} removed={} skipped={}",
        connectionId, summary.mode(), summary.rounds(), totals.upserted(), totals.promoted(),
        totals.removed(), totals.skipped());

    int accountsUpdated = 0;
    if (incremental && properties.refreshBalances()) {
      accountsUpdated = balanceRefreshService.refresh(connection, accessToken).updated();
    }
    return SyncOutcome.success(connectionId, summary.mode(), totals, accountsUpdated, summary.cursor());
  }

  private boolean claim(UUID connectionId, boolean force) {
    Instant now = Instant.now();
    if (force) {
      return connectionRepository.forceClaimSync(connectionId, now) > 0;
    }
    long staleMinutes = properties.staleLockMinutes() > 0 ? properties.staleLockMinutes() : DEFAULT_STALE_LOCK_MINUTES;
    return connectionRepository.claimSync(connectionId, now, now.minus(Duration.ofMinutes(staleMinutes))) > 0;
  }

  private SyncOutcome fail(UUID connectionId, SyncErrorCode code, String message, Exception cause) {
    log.error("Sync of connection {} failed with {}", connectionId, code, cause);
    try {
      connectionRepository.failSync(connectionId, message, Instant.now());
    } catch (RuntimeException ex) {
      log.error("Could not record sync failure for connection {}", connectionId, ex);
    }
    return SyncOutcome.failure(connectionId, code, message);
  }

  private void markItemError(UUID connectionId, PlaidApiException ex) {
    try {
      connectionRepository.updateStatus(connectionId, ConnectionStatus.ERROR, ex.getMessage(), Instant.now());
    } catch (RuntimeException updateError) {
      log.error("Could not flag connection {} as errored", connectionId, updateError);
    }
  }
}
