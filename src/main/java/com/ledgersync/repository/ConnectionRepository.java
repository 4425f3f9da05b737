package com.ledgersync.repository;

import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ConnectionRepository extends JpaRepository<Connection, UUID> {
  List<Connection> findByUserId(UUID userId);
  Optional<Connection> findByIdAndUserId(UUID id, UUID userId);
  Optional<Connection> findByExternalId(String externalId);
  List<Connection> findByAutoSyncEnabledTrueAndStatus(ConnectionStatus status);

  /**
   * Atomically flips the connection to {@code SYNCING}. A missing status counts as idle, and a
   * {@code SYNCING} flag set before {@code staleBefore} is treated as abandoned.
   *
   * @return 1 when the caller now owns the run, 0 when another run holds it
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.ledgersync.model.SyncStatus.SYNCING, " +
      "c.lastSyncStartedAt = :now, c.lastSyncError = null, c.updatedAt = :now " +
      "where c.id = :id and (c.syncStatus is null " +
      "or c.syncStatus <> com.ledgersync.model.SyncStatus.SYNCING " +
      "or c.lastSyncStartedAt < :staleBefore)")
  int claimSync(@Param("id") UUID id, @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.ledgersync.model.SyncStatus.SYNCING, " +
      "c.lastSyncStartedAt = :now, c.lastSyncError = null, c.updatedAt = :now where c.id = :id")
  int forceClaimSync(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.ledgersync.model.SyncStatus.IDLE, " +
      "c.status = case when c.status = com.ledgersync.model.ConnectionStatus.ERROR " +
      "then com.ledgersync.model.ConnectionStatus.ACTIVE else c.status end, " +
      "c.errorMessage = null, c.lastSyncedAt = :now, c.lastSyncCompletedAt = :now, " +
      "c.lastSyncError = null, c.updatedAt = :now where c.id = :id")
  int completeSync(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.ledgersync.model.SyncStatus.ERROR, " +
      "c.lastSyncCompletedAt = :now, c.lastSyncError = :error, c.updatedAt = :now where c.id = :id")
  int failSync(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

  /**
   * Same as {@link #completeSync} and also stores the cursor the run ended on, in one statement.
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.syncStatus = com.ledgersync.model.SyncStatus.IDLE, " +
      "c.status = case when c.status = com.ledgersync.model.ConnectionStatus.ERROR " +
      "then com.ledgersync.model.ConnectionStatus.ACTIVE else c.status end, " +
      "c.cursor = :cursor, c.errorMessage = null, c.lastSyncedAt = :now, c.lastSyncCompletedAt = :now, " +
      "c.lastSyncError = null, c.updatedAt = :now where c.id = :id")
  int completeSyncWithCursor(@Param("id") UUID id, @Param("cursor") String cursor, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.cursor = null, c.updatedAt = :now where c.id = :id")
  int resetCursor(@Param("id") UUID id, @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.status = :status, c.errorMessage = :errorMessage, " +
      "c.updatedAt = :now where c.id = :id")
  int updateStatus(@Param("id") UUID id,
                   @Param("status") ConnectionStatus status,
                   @Param("errorMessage") String errorMessage,
                   @Param("now") Instant now);

  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Connection c set c.status = com.ledgersync.model.ConnectionStatus.REVOKED, " +
      "c.autoSyncEnabled = false, c.updatedAt = :now where c.id = :id")
  int revoke(@Param("id") UUID id, @Param("now") Instant now);
}
